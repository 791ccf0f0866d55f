package work.pollochang.galaxy.core;

import org.junit.jupiter.api.Test;
import work.pollochang.galaxy.exception.TransportException;

import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class GalaxyRecordTest {

    private static final ImagingDescriptor DESCRIPTOR =
            new ImagingDescriptor(1237648720693755918L, 756, 3, 206, 10.5, -0.25, 12.3);

    private static BandOutcome ok(Band band) {
        return BandOutcome.success(new BandImage(band, new CutoutSpec(0, 2, 0, 2), new float[2][2]));
    }

    @Test
    void testAssemble_ShouldOrderBandsCanonically() {
        GalaxyRecord record = GalaxyRecord.assemble(DESCRIPTOR, null,
                List.of(ok(Band.Z), ok(Band.U), ok(Band.I), ok(Band.G), ok(Band.R)));

        List<Band> order = record.bands().stream().map(BandImage::band).collect(Collectors.toList());
        assertEquals(List.of(Band.U, Band.G, Band.R, Band.I, Band.Z), order);
        assertEquals(DESCRIPTOR.objectId(), record.objectId());
        assertTrue(record.preview().isEmpty());
        assertTrue(record.band(Band.R).isPresent());
    }

    @Test
    void testAssemble_AnyFailedBand_ShouldFailWholeRecord() {
        TransportException e = assertThrows(TransportException.class, () -> GalaxyRecord.assemble(DESCRIPTOR, null,
                List.of(ok(Band.U), BandOutcome.failure(Band.G, "HTTP 404"), ok(Band.R))));

        assertTrue(e.getMessage().contains("g: HTTP 404"));
    }

    @Test
    void testSubset_ShouldOnlyHoldSelectedBands() {
        GalaxyRecord record = GalaxyRecord.assemble(DESCRIPTOR, null, List.of(ok(Band.R), ok(Band.G)));

        assertEquals(2, record.bands().size());
        assertTrue(record.band(Band.U).isEmpty());
    }

    @Test
    void testInfo_ShouldSummarizeRecord() {
        GalaxyRecord record = GalaxyRecord.assemble(DESCRIPTOR, null, List.of(ok(Band.G), ok(Band.R)));

        String info = record.info();
        assertTrue(info.contains("SDSS 1237648720693755918"));
        assertTrue(info.contains("756/3/206"));
        assertTrue(info.contains("10.50000"));
        assertTrue(info.contains("-0.25000"));
        assertTrue(info.contains("gr"));
    }

    @Test
    void testBands_ShouldBeUnmodifiable() {
        GalaxyRecord record = GalaxyRecord.assemble(DESCRIPTOR, null, List.of(ok(Band.G)));

        assertThrows(UnsupportedOperationException.class, () -> record.bands().clear());
    }
}
