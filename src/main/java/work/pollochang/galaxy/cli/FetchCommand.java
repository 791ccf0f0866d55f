package work.pollochang.galaxy.cli;

import lombok.extern.slf4j.Slf4j;
import picocli.CommandLine.ArgGroup;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Option;
import work.pollochang.galaxy.catalog.Target;
import work.pollochang.galaxy.core.Band;
import work.pollochang.galaxy.core.GalaxyRecord;
import work.pollochang.galaxy.core.SkyCoordinate;
import work.pollochang.galaxy.exception.InvalidInputException;
import work.pollochang.galaxy.report.GalaxyRecordWriter;

import java.io.File;
import java.nio.file.Path;
import java.util.Set;
import java.util.concurrent.Callable;

@Slf4j
@Command(name = "fetch", mixinStandardHelpOptions = true, description = "依物件編號或座標下載單一星系的多波段裁切。")
public class FetchCommand implements Callable<Integer> {

    @Mixin
    private ServiceOptions services;

    @ArgGroup(exclusive = true, multiplicity = "1")
    private TargetOptions target;

    static class TargetOptions {
        @Option(names = {"--objid"}, required = true, description = "SDSS 物件編號。")
        Long objectId;

        @ArgGroup(exclusive = false)
        CoordinateOptions coordinate;
    }

    static class CoordinateOptions {
        @Option(names = {"--ra"}, required = true, description = "赤經(度)。")
        double ra;

        @Option(names = {"--dec"}, required = true, description = "赤緯(度)。")
        double dec;
    }

    @Option(names = {"-r", "--max-radius"}, defaultValue = "8.0", description = "座標搜尋的最大半徑(角分) (預設: 8.0)。")
    private double maxRadius;

    @Option(names = {"-o", "--output-dir"}, defaultValue = ".", description = "輸出目錄 (預設: 目前目錄)。")
    private File outputDir;

    @Option(names = {"-b", "--bands"}, defaultValue = "ugriz", description = "要下載的波段 (預設: ugriz)。")
    private String bands;

    @Override
    public Integer call() {
        Set<Band> selection = Band.parseSelection(bands);
        if (target.coordinate != null && !SkyCoordinate.isValid(target.coordinate.ra, target.coordinate.dec)) {
            throw new InvalidInputException(String.format("座標超出範圍: ra=%s, dec=%s", target.coordinate.ra, target.coordinate.dec));
        }
        Target resolved = target.objectId != null
                ? Target.ofObjectId(target.objectId)
                : Target.ofCoordinate(target.coordinate.ra, target.coordinate.dec, maxRadius);

        log.info("========================================單一星系參數設定========================================");
        log.info("目標: {}", resolved);
        log.info("輸出目錄: {}", outputDir.getAbsolutePath());
        log.info("波段: {}", selection);
        services.logSettings();
        log.info("========================================單一星系參數設定========================================");

        GalaxyRecord record = services.galaxyFetcher().fetch(resolved, selection);
        Path dir = new GalaxyRecordWriter(outputDir.toPath()).write(record);
        log.info("輸出完成: {}", dir.toAbsolutePath());
        System.out.println(record.info());
        return 0;
    }
}
