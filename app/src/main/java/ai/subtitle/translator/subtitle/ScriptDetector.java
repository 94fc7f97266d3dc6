package ai.subtitle.translator.subtitle;

/**
 * Detects target-language script by Unicode range. Only the CJK Unified Ideographs block is considered.
 */
public final class ScriptDetector {

    private static final char CJK_FIRST = '\u4E00';
    private static final char CJK_LAST = '\u9FFF';

    private ScriptDetector() {
    }

    public static boolean isCjk(char ch) {
        return ch >= CJK_FIRST && ch <= CJK_LAST;
    }

    public static int countCjk(String text) {
        if (text == null || text.isEmpty()) {
            return 0;
        }
        int count = 0;
        for (int i = 0; i < text.length(); i++) {
            if (isCjk(text.charAt(i))) {
                count++;
            }
        }
        return count;
    }

    public static boolean containsCjk(String text) {
        if (text == null) {
            return false;
        }
        for (int i = 0; i < text.length(); i++) {
            if (isCjk(text.charAt(i))) {
                return true;
            }
        }
        return false;
    }
}
