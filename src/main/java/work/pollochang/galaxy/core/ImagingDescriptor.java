package work.pollochang.galaxy.core;

/**
 * 已解析星系的成像資訊。
 * @param objectId 目錄物件編號
 * @param run SDSS run
 * @param camcol 相機欄 (1-6)
 * @param field 視場編號
 * @param ra 赤經 (度)
 * @param dec 赤緯 (度)
 * @param angularSize 角大小 (角秒，r 波段 Petrosian 半徑)
 */
public record ImagingDescriptor(long objectId, int run, int camcol, int field,
                                double ra, double dec, double angularSize) {}
