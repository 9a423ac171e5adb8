package org.ifcserver.ifc.step;

/**
 * STEP 字符串字面量的编码/解码。
 * <p>
 * 写出时：
 * <ul>
 *   <li>{@code '} 写为 {@code ''}，{@code \} 写为 {@code \\}</li>
 *   <li>非 ASCII 的 BMP 字符写为 {@code \X2\hhhh...\X0\}（UCS-2），增补平面字符写为 {@code \X4\hhhhhhhh\X0\}</li>
 * </ul>
 * 读取时反向解码，同时兼容 {@code \X\hh} 单字节转义。
 * <p>
 * 示例：{@code "中文"} &lt;-&gt; {@code \X2\4E2D6587\X0\}
 */
public final class StepStrings {

    private StepStrings() {
    }

    public static String encode(String value) {
        if (value == null || value.isEmpty()) {
            return value;
        }
        StringBuilder out = new StringBuilder(value.length() + 8);
        int i = 0;
        while (i < value.length()) {
            int cp = value.codePointAt(i);
            if (cp == '\'') {
                out.append("''");
                i++;
                continue;
            }
            if (cp == '\\') {
                out.append("\\\\");
                i++;
                continue;
            }
            if (cp >= 0x20 && cp < 0x7F) {
                out.append((char) cp);
                i++;
                continue;
            }

            // 连续的非 ASCII 字符合并进同一个 \X2\ 或 \X4\ 段
            boolean supplementary = Character.isSupplementaryCodePoint(cp);
            out.append(supplementary ? "\\X4\\" : "\\X2\\");
            while (i < value.length()) {
                int next = value.codePointAt(i);
                if ((next >= 0x20 && next < 0x7F) || Character.isSupplementaryCodePoint(next) != supplementary) {
                    break;
                }
                out.append(String.format(supplementary ? "%08X" : "%04X", next));
                i += Character.charCount(next);
            }
            out.append("\\X0\\");
        }
        return out.toString();
    }

    public static String decode(String value) {
        if (value == null || value.isEmpty() || value.indexOf('\\') < 0) {
            return value;
        }

        StringBuilder out = new StringBuilder(value.length());
        int len = value.length();
        for (int i = 0; i < len; i++) {
            char c = value.charAt(i);
            if (c != '\\' || i + 1 >= len) {
                out.append(c);
                continue;
            }
            char x = value.charAt(i + 1);
            if (x == '\\') {
                out.append('\\');
                i++;
                continue;
            }
            if ((x != 'X' && x != 'x') || i + 2 >= len) {
                out.append(c);
                continue;
            }

            char mode = value.charAt(i + 2);
            if ((mode == '2' || mode == '4') && i + 3 < len && value.charAt(i + 3) == '\\') {
                int seqStart = i + 4;
                int endMarker = indexOfEndMarker(value, seqStart);
                if (endMarker > 0) {
                    String decoded = decodeHexSequence(value.substring(seqStart, endMarker), mode);
                    if (decoded != null) {
                        out.append(decoded);
                        // i 最终会自增 1，因此这里 +3 让它落在 "\X0\" 之后
                        i = endMarker + 3;
                        continue;
                    }
                }
            }

            // \X\hh（单字节十六进制）
            if (mode == '\\' && i + 4 < len) {
                int b = hexByte(value.charAt(i + 3), value.charAt(i + 4));
                if (b >= 0) {
                    out.append((char) b);
                    i += 4;
                    continue;
                }
            }

            out.append(c);
        }
        return out.toString();
    }

    private static int indexOfEndMarker(String text, int fromIndex) {
        for (int i = Math.max(0, fromIndex); i + 3 < text.length(); i++) {
            if (text.charAt(i) == '\\'
                    && (text.charAt(i + 1) == 'X' || text.charAt(i + 1) == 'x')
                    && text.charAt(i + 2) == '0'
                    && text.charAt(i + 3) == '\\') {
                return i;
            }
        }
        return -1;
    }

    private static String decodeHexSequence(String hexText, char mode) {
        int group = (mode == '4') ? 8 : 4;
        if (hexText.isEmpty() || hexText.length() % group != 0) {
            return null;
        }
        StringBuilder out = new StringBuilder(hexText.length() / group);
        for (int i = 0; i < hexText.length(); i += group) {
            int codePoint;
            try {
                codePoint = Integer.parseInt(hexText.substring(i, i + group), 16);
            } catch (NumberFormatException e) {
                return null;
            }
            if (!Character.isValidCodePoint(codePoint)) {
                return null;
            }
            out.appendCodePoint(codePoint);
        }
        return out.toString();
    }

    private static int hexByte(char hi, char lo) {
        int a = Character.digit(hi, 16);
        int b = Character.digit(lo, 16);
        if (a < 0 || b < 0) {
            return -1;
        }
        return (a << 4) | b;
    }
}
