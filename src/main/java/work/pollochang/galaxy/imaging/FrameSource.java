package work.pollochang.galaxy.imaging;

import work.pollochang.galaxy.core.Band;
import work.pollochang.galaxy.core.ImagingDescriptor;

/**
 * 依 (run, camcol, field, band) 取得 frame。
 */
public interface FrameSource {

    /**
     * @throws work.pollochang.galaxy.exception.TransportException 下載或解碼失敗
     */
    Frame load(ImagingDescriptor descriptor, Band band);
}
