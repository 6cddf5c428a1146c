package com.ddm.iris.key;

import com.ddm.iris.defined.LabelRef;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.HexFormat;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * 默认的键推导实现。
 * <p>
 * 推导规则：{@code slug(namespace) + "_" + slug(category) + "_" + slug(normalize(text))}
 * <ul>
 *   <li><strong>normalize</strong>：去掉 {@code {...}} 占位符与数字片段，折叠空白；choice 占位符保留各分支的文字</li>
 *   <li><strong>slug</strong>：小写化，非字母数字的连续字符替换为单个 {@code _}，支持非拉丁文字</li>
 *   <li><strong>截断</strong>：超过 {@code maxLength} 时截断并追加 8 位 SHA-256 摘要，避免截断冲突</li>
 *   <li><strong>无文字</strong>：归一化后为空（如 {@code "{0}"}）时，以 {@link #canonicalize(String)} 结果的摘要作为文案部分</li>
 * </ul>
 *
 * <p><strong>示例：</strong>
 * <pre>{@code
 * KeyDeriver deriver = new DefaultKeyDeriver(64);
 * deriver.derive("travel", "booking", "You have {0} bookings!", null);
 * // -> travel:travel_booking_you_have_bookings
 * }</pre>
 *
 * @author liyifei
 * @since 1.0
 */
public final class DefaultKeyDeriver implements KeyDeriver {

    public static final int DEFAULT_MAX_LENGTH = 64;

    static final String DEFAULT_CATEGORY = "default";

    private static final Pattern NUMBERS = Pattern.compile("\\d+(?:[.,]\\d+)*");
    private static final Pattern SPACES = Pattern.compile("\\s+");
    private static final Pattern NON_WORD = Pattern.compile("[^\\p{L}\\p{N}]+");

    /**
     * 摘要后缀长度（含分隔符）
     */
    private static final int HASH_SUFFIX = 9;

    private final int maxLength;

    public DefaultKeyDeriver() {
        this(DEFAULT_MAX_LENGTH);
    }

    public DefaultKeyDeriver(int maxLength) {
        if (maxLength <= HASH_SUFFIX) {
            throw new IllegalArgumentException("maxLength must be greater than " + HASH_SUFFIX + ": " + maxLength);
        }
        this.maxLength = maxLength;
    }

    @Override
    public LabelRef derive(String namespace, String category, String defaultText, String explicitKey) {
        if (namespace == null || namespace.isBlank()) {
            throw new IllegalArgumentException("namespace must not be blank");
        }
        if (explicitKey != null && !explicitKey.isBlank()) {
            return new LabelRef(namespace, explicitKey);
        }
        String cat = (category == null || category.isBlank()) ? DEFAULT_CATEGORY : category;
        String text = slug(normalize(defaultText));
        if (text.isEmpty() && defaultText != null && !defaultText.isBlank()) {
            text = sha256Prefix(canonicalize(defaultText));
        }
        return new LabelRef(namespace, slug(namespace) + "_" + slug(cat) + "_" + text);
    }

    @Override
    public String normalize(String defaultText) {
        if (defaultText == null || defaultText.isEmpty()) {
            return "";
        }
        String withoutPlaceholders = stripPlaceholders(defaultText);
        String withoutNumbers = NUMBERS.matcher(withoutPlaceholders).replaceAll(" ");
        return SPACES.matcher(withoutNumbers).replaceAll(" ").trim();
    }

    @Override
    public String canonicalize(String defaultText) {
        if (defaultText == null || defaultText.isEmpty()) {
            return "";
        }
        StringBuilder sb = new StringBuilder(defaultText.length());
        StringBuilder literal = new StringBuilder();
        int i = 0;
        while (i < defaultText.length()) {
            char c = defaultText.charAt(i);
            if (c == '{') {
                sb.append(NUMBERS.matcher(literal).replaceAll("0"));
                literal.setLength(0);
                int end = matchingBrace(defaultText, i);
                sb.append(defaultText, i, Math.min(end + 1, defaultText.length()));
                i = end + 1;
            } else {
                literal.append(c);
                i++;
            }
        }
        sb.append(NUMBERS.matcher(literal).replaceAll("0"));
        return SPACES.matcher(sb).replaceAll(" ").trim();
    }

    /**
     * 生成 slug；超长时截断并追加摘要。
     */
    String slug(String s) {
        String lower = s.toLowerCase(Locale.ROOT);
        String slug = trimSeparators(NON_WORD.matcher(lower).replaceAll("_"));
        if (slug.length() <= maxLength) {
            return slug;
        }
        int cut = maxLength - HASH_SUFFIX;
        if (Character.isHighSurrogate(slug.charAt(cut - 1))) {
            cut--;
        }
        return slug.substring(0, cut) + "_" + sha256Prefix(slug);
    }

    /**
     * 去掉花括号包裹的占位符，按深度匹配以支持嵌套；孤立的右括号直接丢弃。
     * <p>choice 占位符只去掉参数头与分支条件，保留各分支子模式中的文字。
     */
    private static String stripPlaceholders(String text) {
        StringBuilder sb = new StringBuilder(text.length());
        int i = 0;
        while (i < text.length()) {
            char c = text.charAt(i);
            if (c == '{') {
                int end = matchingBrace(text, i);
                sb.append(' ');
                appendChoiceWording(text.substring(i + 1, end), sb);
                sb.append(' ');
                i = end + 1;
            } else {
                if (c != '}') {
                    sb.append(c);
                }
                i++;
            }
        }
        return sb.toString();
    }

    /**
     * 形如 {@code n,choice,0#a|1<b} 的占位符内容：追加各分支子模式（递归去掉其中的占位符）。
     */
    private static void appendChoiceWording(String inner, StringBuilder sb) {
        List<String> parts = splitTopLevel(inner, ',', 3);
        if (parts.size() < 3 || !"choice".equals(parts.get(1).trim())) {
            return;
        }
        for (String rule : splitTopLevel(parts.get(2), '|', 0)) {
            int selector = selectorIndex(rule);
            if (selector >= 0) {
                sb.append(' ').append(stripPlaceholders(rule.substring(selector + 1))).append(' ');
            }
        }
    }

    private static int selectorIndex(String rule) {
        for (int i = 0; i < rule.length(); i++) {
            char c = rule.charAt(i);
            if (c == '#' || c == '<' || c == '\u2264') {
                return i;
            }
        }
        return -1;
    }

    /**
     * 按顶层（不在花括号内的）分隔符切分；limit 大于 0 时最多切成 limit 段。
     */
    private static List<String> splitTopLevel(String s, char delimiter, int limit) {
        List<String> parts = new ArrayList<>();
        int depth = 0;
        int start = 0;
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (c == '{') {
                depth++;
            } else if (c == '}' && depth > 0) {
                depth--;
            } else if (c == delimiter && depth == 0 && (limit <= 0 || parts.size() < limit - 1)) {
                parts.add(s.substring(start, i));
                start = i + 1;
            }
        }
        parts.add(s.substring(start));
        return parts;
    }

    /**
     * 返回与 {@code open} 处左括号匹配的右括号下标；不平衡时返回文本长度。
     */
    private static int matchingBrace(String text, int open) {
        int depth = 0;
        for (int i = open; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '{') {
                depth++;
            } else if (c == '}' && --depth == 0) {
                return i;
            }
        }
        return text.length();
    }

    private static String trimSeparators(String s) {
        int start = 0;
        int end = s.length();
        while (start < end && s.charAt(start) == '_') start++;
        while (end > start && s.charAt(end - 1) == '_') end--;
        return s.substring(start, end);
    }

    private static String sha256Prefix(String s) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest(s.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(hash, 0, 4);
        } catch (NoSuchAlgorithmException e) {
            // 所有 JRE 都必须提供 SHA-256
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
