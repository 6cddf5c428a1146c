package com.ddm.iris.format;

import com.ddm.iris.exception.PatternParseException;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.text.DecimalFormat;
import java.text.DecimalFormatSymbols;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * 消息模式解析器，带编译结果缓存。
 * <p>
 * 支持的语法：
 * <ul>
 *   <li><strong>占位符</strong>：{@code {index}}、{@code {index,type}}、{@code {index,type,style}}，
 *       type 取值 number / date / time / choice</li>
 *   <li><strong>number 样式</strong>：integer、percent、currency 或 {@link DecimalFormat} 模式</li>
 *   <li><strong>date/time 样式</strong>：short、medium、long、full 或 {@link DateTimeFormatter} 模式</li>
 *   <li><strong>choice 样式</strong>：{@code 0#no files|1#one file|1<{0} files}，界限须严格升序，子模式可嵌套占位符</li>
 *   <li><strong>引号</strong>：{@code ''} 表示单引号；{@code '} 后紧跟 {@code { } # |} 时开启引用段，直到下一个单引号；
 *       其它位置的单引号按字面输出（如 don't）</li>
 * </ul>
 *
 * <p><strong>缓存策略：</strong>
 * <ul>
 *   <li>按模式文本缓存（Caffeine，容量有界），编译结果不可变</li>
 *   <li>解析失败抛出 {@link PatternParseException}，不写入缓存</li>
 *   <li>模式文本被管理端修改时，由 {@link #invalidate(String)} 淘汰旧条目</li>
 * </ul>
 *
 * @author liyifei
 * @see CompiledPattern
 * @see PatternFormatter
 * @since 1.0
 */
public class MessagePatternParser {

    private static final Logger log = LoggerFactory.getLogger(MessagePatternParser.class);

    public static final long DEFAULT_CACHE_SIZE = 10_000;

    private static final char INFINITY = '∞';
    private static final char LESS_OR_EQUAL = '≤';

    private final Cache<String, CompiledPattern> cache;

    public MessagePatternParser() {
        this(DEFAULT_CACHE_SIZE);
    }

    public MessagePatternParser(long maximumSize) {
        this.cache = Caffeine.newBuilder()
                .maximumSize(maximumSize)
                .build();
    }

    /**
     * 解析并缓存消息模式。
     *
     * @param pattern 模式文本，不能为 null
     * @return 编译结果（相同文本返回同一实例，直到被淘汰）
     * @throws PatternParseException 如果语法错误
     */
    public CompiledPattern parse(String pattern) {
        Objects.requireNonNull(pattern, "pattern");
        return cache.get(pattern, this::compile);
    }

    /**
     * 解析但不写入缓存，用于一次性文本（如 raw 渲染）。
     */
    public CompiledPattern compile(String pattern) {
        Objects.requireNonNull(pattern, "pattern");
        log.trace("Compiling pattern: {}", pattern);
        return compile(pattern, pattern, 0);
    }

    /**
     * 淘汰指定文本的编译结果。
     */
    public void invalidate(String pattern) {
        if (pattern != null) {
            cache.invalidate(pattern);
        }
    }

    /**
     * 当前缓存的条目数（估算值）。
     */
    public long cachedCount() {
        cache.cleanUp();
        return cache.estimatedSize();
    }

    /**
     * @param src    当前待解析的（子）模式
     * @param whole  完整模式，用于错误信息
     * @param offset src 在 whole 中的起始位置
     */
    private CompiledPattern compile(String src, String whole, int offset) {
        List<PatternPart> parts = new ArrayList<>();
        StringBuilder literal = new StringBuilder();
        int n = src.length();
        int i = 0;
        while (i < n) {
            char c = src.charAt(i);
            if (c == '\'') {
                if (i + 1 < n && src.charAt(i + 1) == '\'') {
                    literal.append('\'');
                    i += 2;
                } else if (i + 1 < n && isSyntaxChar(src.charAt(i + 1))) {
                    i = readQuoted(src, i, literal, whole, offset);
                } else {
                    literal.append('\'');
                    i++;
                }
            } else if (c == '{') {
                int end = findClosingBrace(src, i);
                if (end < 0) {
                    throw new PatternParseException("Unmatched '{'", whole, offset + i);
                }
                flush(literal, parts);
                parts.add(parseArgument(src.substring(i + 1, end), whole, offset + i + 1));
                i = end + 1;
            } else if (c == '}') {
                throw new PatternParseException("Unmatched '}'", whole, offset + i);
            } else {
                literal.append(c);
                i++;
            }
        }
        flush(literal, parts);
        return new CompiledPattern(src, parts);
    }

    private PatternPart.Argument parseArgument(String body, String whole, int pos) {
        int firstComma = body.indexOf(',');
        String indexText = firstComma < 0 ? body : body.substring(0, firstComma);
        int index = parseIndex(indexText.trim(), whole, pos);
        if (firstComma < 0) {
            return PatternPart.Argument.plain(index);
        }
        int secondComma = body.indexOf(',', firstComma + 1);
        String typeText = secondComma < 0 ? body.substring(firstComma + 1) : body.substring(firstComma + 1, secondComma);
        FormatType type = FormatType.of(typeText);
        if (type == null) {
            throw new PatternParseException("Unknown format type '" + typeText.trim() + "'", whole, pos + firstComma + 1);
        }
        String style = secondComma < 0 ? null : body.substring(secondComma + 1);
        int stylePos = pos + secondComma + 1;
        return switch (type) {
            case NUMBER -> new PatternPart.Argument(index, type, checkNumberStyle(trimToNull(style), whole, stylePos), null, List.of());
            case DATE, TIME -> {
                String s = trimToNull(style);
                yield new PatternPart.Argument(index, type, s, dateFormatterFor(s, whole, stylePos), List.of());
            }
            case CHOICE -> {
                if (style == null || style.isBlank()) {
                    throw new PatternParseException("Choice format requires a style", whole, pos);
                }
                yield new PatternPart.Argument(index, type, style, null, parseChoice(style, whole, stylePos));
            }
        };
    }

    private static int parseIndex(String text, String whole, int pos) {
        if (text.isEmpty()) {
            throw new PatternParseException("Missing argument index", whole, pos);
        }
        for (int k = 0; k < text.length(); k++) {
            if (!Character.isDigit(text.charAt(k))) {
                throw new PatternParseException("Invalid argument index '" + text + "'", whole, pos);
            }
        }
        try {
            return Integer.parseInt(text);
        } catch (NumberFormatException e) {
            throw new PatternParseException("Invalid argument index '" + text + "'", whole, pos, e);
        }
    }

    private static String checkNumberStyle(String style, String whole, int pos) {
        if (style == null || PatternFormatter.isNamedNumberStyle(style)) {
            return style;
        }
        try {
            new DecimalFormat(style, DecimalFormatSymbols.getInstance(Locale.ROOT));
            return style;
        } catch (IllegalArgumentException e) {
            throw new PatternParseException("Invalid number style '" + style + "'", whole, pos, e);
        }
    }

    private static DateTimeFormatter dateFormatterFor(String style, String whole, int pos) {
        if (style == null || PatternFormatter.isNamedDateStyle(style)) {
            return null;
        }
        try {
            return DateTimeFormatter.ofPattern(style);
        } catch (IllegalArgumentException e) {
            throw new PatternParseException("Invalid date/time style '" + style + "'", whole, pos, e);
        }
    }

    /**
     * 解析 choice 样式：按顶层的 {@code |} 切分规则，每条规则为 {@code limit(#|<|≤)subPattern}。
     */
    private List<PatternPart.ChoiceRule> parseChoice(String style, String whole, int pos) {
        List<PatternPart.ChoiceRule> rules = new ArrayList<>();
        double previous = Double.NaN;
        int segmentStart = 0;
        for (int end : segmentEnds(style)) {
            String segment = style.substring(segmentStart, end);
            int segmentPos = pos + segmentStart;
            int sep = separatorIndex(segment);
            if (sep < 0) {
                throw new PatternParseException("Missing choice separator ('#', '<' or '≤')", whole, segmentPos);
            }
            double limit = parseLimit(segment.substring(0, sep).trim(), whole, segmentPos);
            boolean inclusive = segment.charAt(sep) != '<';
            CompiledPattern sub = compile(segment.substring(sep + 1), whole, segmentPos + sep + 1);
            PatternPart.ChoiceRule rule = new PatternPart.ChoiceRule(limit, inclusive, sub);
            if (!Double.isNaN(previous) && rule.lowerBound() <= previous) {
                throw new PatternParseException("Choice limits must be in ascending order", whole, segmentPos);
            }
            previous = rule.lowerBound();
            rules.add(rule);
            segmentStart = end + 1;
        }
        return rules;
    }

    /**
     * 顶层 {@code |} 的位置（不含引用段与嵌套花括号内部），末尾追加 style.length()。
     */
    private static List<Integer> segmentEnds(String style) {
        List<Integer> ends = new ArrayList<>();
        int depth = 0;
        int n = style.length();
        for (int i = 0; i < n; i++) {
            char c = style.charAt(i);
            if (c == '\'') {
                i = skipQuote(style, i);
            } else if (c == '{') {
                depth++;
            } else if (c == '}') {
                depth--;
            } else if (c == '|' && depth == 0) {
                ends.add(i);
            }
        }
        ends.add(n);
        return ends;
    }

    private static int separatorIndex(String segment) {
        for (int i = 0; i < segment.length(); i++) {
            char c = segment.charAt(i);
            if (c == '#' || c == '<' || c == LESS_OR_EQUAL) {
                return i;
            }
        }
        return -1;
    }

    private static double parseLimit(String text, String whole, int pos) {
        if (text.equals(String.valueOf(INFINITY)) || text.equals("+" + INFINITY)) {
            return Double.POSITIVE_INFINITY;
        }
        if (text.equals("-" + INFINITY)) {
            return Double.NEGATIVE_INFINITY;
        }
        try {
            double value = Double.parseDouble(text);
            if (Double.isNaN(value)) {
                throw new PatternParseException("Choice limit must be a number", whole, pos);
            }
            return value;
        } catch (NumberFormatException e) {
            throw new PatternParseException("Invalid choice limit '" + text + "'", whole, pos, e);
        }
    }

    /**
     * 读取引用段，返回引用段结束后的位置。
     */
    private static int readQuoted(String src, int quoteStart, StringBuilder out, String whole, int offset) {
        int n = src.length();
        int j = quoteStart + 1;
        while (j < n) {
            char c = src.charAt(j);
            if (c == '\'') {
                if (j + 1 < n && src.charAt(j + 1) == '\'') {
                    out.append('\'');
                    j += 2;
                    continue;
                }
                return j + 1;
            }
            out.append(c);
            j++;
        }
        throw new PatternParseException("Unterminated quoted literal", whole, offset + quoteStart);
    }

    /**
     * 从 {@code '} 处跳过引号（或整个引用段），返回最后一个被消费字符的位置。
     */
    private static int skipQuote(String src, int i) {
        int n = src.length();
        if (i + 1 < n && src.charAt(i + 1) == '\'') {
            return i + 1;
        }
        if (i + 1 < n && isSyntaxChar(src.charAt(i + 1))) {
            int j = i + 1;
            while (j < n) {
                if (src.charAt(j) == '\'') {
                    if (j + 1 < n && src.charAt(j + 1) == '\'') {
                        j += 2;
                        continue;
                    }
                    return j;
                }
                j++;
            }
            return n - 1;
        }
        return i;
    }

    /**
     * 查找与 start 处 {@code {} 匹配的右括号，考虑嵌套与引用段；找不到返回 -1。
     */
    private static int findClosingBrace(String src, int start) {
        int depth = 0;
        for (int j = start; j < src.length(); j++) {
            char c = src.charAt(j);
            if (c == '\'') {
                j = skipQuote(src, j);
            } else if (c == '{') {
                depth++;
            } else if (c == '}') {
                depth--;
                if (depth == 0) {
                    return j;
                }
            }
        }
        return -1;
    }

    private static boolean isSyntaxChar(char c) {
        return c == '{' || c == '}' || c == '#' || c == '|';
    }

    private static void flush(StringBuilder literal, List<PatternPart> parts) {
        if (!literal.isEmpty()) {
            parts.add(new PatternPart.Literal(literal.toString()));
            literal.setLength(0);
        }
    }

    private static String trimToNull(String s) {
        if (s == null) return null;
        String t = s.trim();
        return t.isEmpty() ? null : t;
    }
}
