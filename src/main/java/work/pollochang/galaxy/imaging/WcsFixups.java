package work.pollochang.galaxy.imaging;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 建立座標轉換時對 header 做的修正紀錄。
 * <p>
 * 每次建立轉換各用一個實例，由呼叫端決定如何處理，不影響其他執行緒。
 */
public class WcsFixups {

    private final List<String> messages = new ArrayList<>();

    public void record(String message) {
        messages.add(message);
    }

    public List<String> messages() {
        return Collections.unmodifiableList(messages);
    }

    public boolean isEmpty() {
        return messages.isEmpty();
    }
}
