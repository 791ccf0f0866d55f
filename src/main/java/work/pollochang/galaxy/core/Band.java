package work.pollochang.galaxy.core;

import work.pollochang.galaxy.exception.InvalidInputException;

import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;

/**
 * SDSS 五個濾鏡波段，宣告順序即輸出順序 (u, g, r, i, z)。
 */
public enum Band {
    U('u', "紫外 (354 nm)"),
    G('g', "綠 (477 nm)"),
    R('r', "紅 (623 nm)"),
    I('i', "近紅外 (763 nm)"),
    Z('z', "紅外 (913 nm)");

    private final char letter;
    private final String description;

    Band(char letter, String description) {
        this.letter = letter;
        this.description = description;
    }

    public char getLetter() { return letter; }
    public String getDescription() { return description; }

    public static Band fromLetter(char letter) {
        char lower = Character.toLowerCase(letter);
        for (Band band : values()) {
            if (band.letter == lower) {
                return band;
            }
        }
        throw new InvalidInputException("未知的波段: '" + letter + "' (可用: ugriz)");
    }

    /**
     * 解析波段選擇字串，例如 "ugriz"、"g,r,i"。
     * 回傳的集合依 u,g,r,i,z 排序，與輸入順序無關。
     *
     * @param selection 波段字母，可用逗號或空白分隔
     * @return 選取的波段
     * @throws InvalidInputException 空字串或含未知字母
     */
    public static Set<Band> parseSelection(String selection) {
        if (selection == null || selection.isBlank()) {
            throw new InvalidInputException("波段選擇不可為空");
        }
        Set<Band> bands = EnumSet.noneOf(Band.class);
        for (char c : selection.toLowerCase(Locale.ROOT).toCharArray()) {
            if (c == ',' || Character.isWhitespace(c)) {
                continue;
            }
            bands.add(fromLetter(c));
        }
        if (bands.isEmpty()) {
            throw new InvalidInputException("波段選擇不可為空: '" + selection + "'");
        }
        return bands;
    }

    @Override
    public String toString() {
        return String.valueOf(letter);
    }
}
