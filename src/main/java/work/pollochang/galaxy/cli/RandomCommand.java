package work.pollochang.galaxy.cli;

import lombok.extern.slf4j.Slf4j;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Option;
import work.pollochang.galaxy.GalaxyFetcher;
import work.pollochang.galaxy.catalog.RandomFieldSampler;
import work.pollochang.galaxy.catalog.SearchConstraints;
import work.pollochang.galaxy.catalog.SkyWindow;
import work.pollochang.galaxy.catalog.Target;
import work.pollochang.galaxy.core.Band;
import work.pollochang.galaxy.core.GalaxyRecord;
import work.pollochang.galaxy.exception.InvalidInputException;
import work.pollochang.galaxy.exception.NotFoundException;
import work.pollochang.galaxy.report.GalaxyRecordWriter;

import java.io.File;
import java.nio.file.Path;
import java.util.Random;
import java.util.Set;
import java.util.concurrent.Callable;

@Slf4j
@Command(name = "random", mixinStandardHelpOptions = true, description = "隨機挑選一個星系並下載多波段裁切。")
public class RandomCommand implements Callable<Integer> {

    @Mixin
    private ServiceOptions services;

    @Option(names = {"-o", "--output-dir"}, defaultValue = ".", description = "輸出目錄 (預設: 目前目錄)。")
    private File outputDir;

    @Option(names = {"-b", "--bands"}, defaultValue = "ugriz", description = "要下載的波段 (預設: ugriz)。")
    private String bands;

    @Option(names = {"--min-size"}, defaultValue = "5.0", description = "r 波段 Petrosian 半徑下限(角秒) (預設: 5.0)。")
    private double minAngularSize;

    @Option(names = {"--seed"}, description = "隨機種子，指定後挑選結果可重現。")
    private Long seed;

    @Option(names = {"--max-fields"}, defaultValue = "3", description = "天區內沒有星系時最多換幾個天區 (預設: 3)。")
    private int maxFields;

    @Override
    public Integer call() {
        Set<Band> selection = Band.parseSelection(bands);
        if (maxFields < 1) {
            throw new InvalidInputException("--max-fields 必須至少為 1: " + maxFields);
        }

        log.info("========================================隨機星系參數設定========================================");
        log.info("輸出目錄: {}", outputDir.getAbsolutePath());
        log.info("波段: {}", selection);
        log.info("Petrosian 半徑下限: {}\"", minAngularSize);
        log.info("隨機種子: {}", seed == null ? "不指定" : seed);
        services.logSettings();
        log.info("========================================隨機星系參數設定========================================");

        RandomFieldSampler sampler = new RandomFieldSampler(seed == null ? new Random() : new Random(seed));
        GalaxyFetcher fetcher = services.galaxyFetcher();

        NotFoundException lastMiss = null;
        for (int attempt = 1; attempt <= maxFields; attempt++) {
            SkyWindow window = sampler.next();
            Target target = Target.random(new SearchConstraints(window, true, minAngularSize, true));
            try {
                GalaxyRecord record = fetcher.fetch(target, selection);
                Path dir = new GalaxyRecordWriter(outputDir.toPath()).write(record);
                log.info("輸出完成: {}", dir.toAbsolutePath());
                System.out.println(record.info());
                return 0;
            } catch (NotFoundException e) {
                log.warn("第 {} 個天區 {} - {}", attempt, window, e.getMessage());
                lastMiss = e;
            }
        }
        throw lastMiss;
    }
}
