package work.pollochang.galaxy;

import lombok.extern.slf4j.Slf4j;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import work.pollochang.galaxy.cli.BatchCommand;
import work.pollochang.galaxy.cli.FetchCommand;
import work.pollochang.galaxy.cli.RandomCommand;
import work.pollochang.galaxy.exception.InvalidInputException;

import java.io.File;

@Slf4j
@Command(name = "galaxy-cutout",
        mixinStandardHelpOptions = true,
        version = "0.1.0",
        description = "SDSS 星系多波段影像裁切工具",
        subcommands = {RandomCommand.class, FetchCommand.class, BatchCommand.class})
public class Execute implements Runnable {

    static final int EXIT_INVALID_INPUT = 2;
    static final int EXIT_FAILURE = 1;

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @Override
    public void run() {
        // 沒有指定子命令
        throw new CommandLine.ParameterException(spec.commandLine(), "請指定子命令: random, fetch 或 batch");
    }

    static CommandLine commandLine() {
        CommandLine commandLine = new CommandLine(new Execute());
        File defaults = new File(System.getProperty("user.home"), ".galaxy-cutout.properties");
        if (defaults.isFile()) {
            commandLine.setDefaultValueProvider(new CommandLine.PropertiesDefaultProvider(defaults));
        }
        commandLine.setExecutionExceptionHandler((ex, cmd, parseResult) -> {
            if (ex instanceof InvalidInputException) {
                log.error("輸入錯誤: {}", ex.getMessage());
                return EXIT_INVALID_INPUT;
            }
            log.error("執行失敗: {}", ex.getMessage(), ex);
            return EXIT_FAILURE;
        });
        return commandLine;
    }

    public static void main(String[] args) {
        int exitCode = commandLine().execute(args);
        System.exit(exitCode);
    }
}
