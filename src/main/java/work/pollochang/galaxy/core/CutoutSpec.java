package work.pollochang.galaxy.core;

/**
 * 裁切框 (像素，左閉右開：min 含、max 不含)。
 * @param minX 左邊界
 * @param maxX 右邊界
 * @param minY 下邊界
 * @param maxY 上邊界
 */
public record CutoutSpec(int minX, int maxX, int minY, int maxY) {

    public CutoutSpec {
        if (maxX <= minX || maxY <= minY) {
            throw new IllegalArgumentException(
                    String.format("裁切框大小必須為正: x=[%d,%d] y=[%d,%d]", minX, maxX, minY, maxY));
        }
    }

    public int width() {
        return maxX - minX;
    }

    public int height() {
        return maxY - minY;
    }
}
