package com.ddm.iris.format;

import com.ddm.iris.exception.PatternFormatException;
import com.ddm.iris.utils.Temporals;

import java.text.DecimalFormat;
import java.text.DecimalFormatSymbols;
import java.text.NumberFormat;
import java.time.DateTimeException;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.time.format.FormatStyle;
import java.time.temporal.TemporalAccessor;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * 消息模式渲染器：将 {@link CompiledPattern} 与位置参数列表渲染为最终字符串。
 *
 * <p><strong>渲染规则：</strong>
 * <ul>
 *   <li>number / date / time 依赖 JDK 的本地化数据（分组符号、月份名称等），本类只负责分派</li>
 *   <li>choice 选择下界不大于参数值的最后一条规则，子模式使用同一参数列表递归渲染</li>
 *   <li>{@link FormattedArgument} 携带的格式器覆盖占位符自身的类型与样式</li>
 *   <li>参数缺失、类型不符、choice 无法匹配时抛出 {@link PatternFormatException}，不输出部分结果</li>
 * </ul>
 *
 * <p>本类无状态（zone 除外），线程安全。
 *
 * @author liyifei
 * @see MessagePatternParser
 * @since 1.0
 */
public class PatternFormatter {

    private final ZoneId zone;

    public PatternFormatter() {
        this(ZoneId.systemDefault());
    }

    /**
     * @param zone {@link java.util.Date} / {@link java.time.Instant} 参数的展示时区
     */
    public PatternFormatter(ZoneId zone) {
        this.zone = Objects.requireNonNull(zone, "zone");
    }

    /**
     * 渲染消息模式。
     *
     * @param pattern 已编译的模式
     * @param args    位置参数，元素可为 null
     * @param locale  目标语言
     * @return 渲染结果
     * @throws PatternFormatException 如果参数缺失或类型不符
     */
    public String format(CompiledPattern pattern, List<?> args, Locale locale) {
        Objects.requireNonNull(pattern, "pattern");
        Objects.requireNonNull(locale, "locale");
        List<?> values = args == null ? List.of() : args;
        StringBuilder out = new StringBuilder(pattern.source().length() + 16);
        append(out, pattern, values, locale);
        return out.toString();
    }

    private void append(StringBuilder out, CompiledPattern pattern, List<?> args, Locale locale) {
        for (PatternPart part : pattern.parts()) {
            if (part instanceof PatternPart.Literal literal) {
                out.append(literal.text());
            } else if (part instanceof PatternPart.Argument arg) {
                appendArgument(out, pattern, arg, args, locale);
            }
        }
    }

    private void appendArgument(StringBuilder out, CompiledPattern pattern, PatternPart.Argument arg,
                                List<?> args, Locale locale) {
        if (arg.index() >= args.size()) {
            throw new PatternFormatException("Missing argument {" + arg.index() + "} (" + args.size() + " given)",
                    pattern.source());
        }
        Object raw = args.get(arg.index());
        ArgumentFormatter extension = null;
        Object value = raw;
        if (raw instanceof FormattedArgument formatted) {
            extension = formatted.formatter();
            value = formatted.value();
        }
        if (arg.type() == FormatType.CHOICE) {
            appendChoice(out, pattern, arg, value, args, locale);
            return;
        }
        if (extension != null) {
            out.append(applyExtension(extension, value, arg, pattern, locale));
            return;
        }
        if (arg.type() == null) {
            out.append(formatPlain(value, arg, pattern, locale));
            return;
        }
        out.append(switch (arg.type()) {
            case NUMBER -> formatNumber(value, arg, pattern, locale);
            case DATE, TIME -> formatTemporal(value, arg, pattern, locale);
            case CHOICE -> throw new IllegalStateException("choice handled above");
        });
    }

    private void appendChoice(StringBuilder out, CompiledPattern pattern, PatternPart.Argument arg,
                              Object value, List<?> args, Locale locale) {
        if (!(value instanceof Number number)) {
            throw new PatternFormatException("Argument {" + arg.index() + "} is not a number for choice: "
                    + describe(value), pattern.source());
        }
        double d = number.doubleValue();
        if (Double.isNaN(d)) {
            throw new PatternFormatException("Argument {" + arg.index() + "} is NaN", pattern.source());
        }
        PatternPart.ChoiceRule selected = null;
        for (PatternPart.ChoiceRule rule : arg.choices()) {
            if (!rule.matches(d)) {
                break;
            }
            selected = rule;
        }
        if (selected == null) {
            throw new PatternFormatException("No choice rule matches value " + number, pattern.source());
        }
        append(out, selected.pattern(), args, locale);
    }

    private String applyExtension(ArgumentFormatter extension, Object value, PatternPart.Argument arg,
                                  CompiledPattern pattern, Locale locale) {
        try {
            String formatted = extension.format(value, locale);
            if (formatted == null) {
                throw new PatternFormatException("Argument formatter returned null for {" + arg.index() + "}",
                        pattern.source());
            }
            return formatted;
        } catch (PatternFormatException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new PatternFormatException("Argument formatter failed for {" + arg.index() + "}: "
                    + e.getMessage(), pattern.source(), e);
        }
    }

    private String formatPlain(Object value, PatternPart.Argument arg, CompiledPattern pattern, Locale locale) {
        if (value instanceof Number number) {
            return NumberFormat.getInstance(locale).format(number);
        }
        TemporalAccessor temporal = Temporals.toTemporal(value, zone);
        if (temporal == null || !(Temporals.hasDate(temporal) || Temporals.hasTime(temporal))) {
            return String.valueOf(value);
        }
        try {
            return defaultTemporalFormatter(temporal).withLocale(locale).format(temporal);
        } catch (DateTimeException e) {
            throw new PatternFormatException("Cannot format argument {" + arg.index() + "}: " + e.getMessage(),
                    pattern.source(), e);
        }
    }

    private String formatNumber(Object value, PatternPart.Argument arg, CompiledPattern pattern, Locale locale) {
        if (!(value instanceof Number number)) {
            throw new PatternFormatException("Argument {" + arg.index() + "} is not a number: " + describe(value),
                    pattern.source());
        }
        String style = arg.style();
        NumberFormat format;
        if (style == null) {
            format = NumberFormat.getInstance(locale);
        } else {
            format = switch (style.toLowerCase(Locale.ROOT)) {
                case "integer" -> NumberFormat.getIntegerInstance(locale);
                case "percent" -> NumberFormat.getPercentInstance(locale);
                case "currency" -> NumberFormat.getCurrencyInstance(locale);
                default -> new DecimalFormat(style, DecimalFormatSymbols.getInstance(locale));
            };
        }
        return format.format(number);
    }

    private String formatTemporal(Object value, PatternPart.Argument arg, CompiledPattern pattern, Locale locale) {
        TemporalAccessor temporal = Temporals.toTemporal(value, zone);
        if (temporal == null) {
            throw new PatternFormatException("Argument {" + arg.index() + "} is not a date/time: " + describe(value),
                    pattern.source());
        }
        DateTimeFormatter formatter = arg.dateFormatter();
        if (formatter == null) {
            FormatStyle style = namedStyle(arg.style());
            formatter = arg.type() == FormatType.DATE
                    ? DateTimeFormatter.ofLocalizedDate(style)
                    : DateTimeFormatter.ofLocalizedTime(style);
        }
        try {
            return formatter.withLocale(locale).format(temporal);
        } catch (DateTimeException e) {
            throw new PatternFormatException("Cannot format argument {" + arg.index() + "} as "
                    + arg.type().name().toLowerCase(Locale.ROOT) + ": " + e.getMessage(), pattern.source(), e);
        }
    }

    private static DateTimeFormatter defaultTemporalFormatter(TemporalAccessor temporal) {
        boolean date = Temporals.hasDate(temporal);
        boolean time = Temporals.hasTime(temporal);
        if (date && time) {
            return DateTimeFormatter.ofLocalizedDateTime(FormatStyle.MEDIUM);
        }
        return date ? DateTimeFormatter.ofLocalizedDate(FormatStyle.MEDIUM)
                : DateTimeFormatter.ofLocalizedTime(FormatStyle.MEDIUM);
    }

    private static FormatStyle namedStyle(String style) {
        if (style == null) {
            return FormatStyle.MEDIUM;
        }
        return switch (style.toLowerCase(Locale.ROOT)) {
            case "short" -> FormatStyle.SHORT;
            case "long" -> FormatStyle.LONG;
            case "full" -> FormatStyle.FULL;
            default -> FormatStyle.MEDIUM;
        };
    }

    static boolean isNamedNumberStyle(String style) {
        return switch (style.toLowerCase(Locale.ROOT)) {
            case "integer", "percent", "currency" -> true;
            default -> false;
        };
    }

    static boolean isNamedDateStyle(String style) {
        return switch (style.toLowerCase(Locale.ROOT)) {
            case "short", "medium", "long", "full" -> true;
            default -> false;
        };
    }

    private static String describe(Object value) {
        return value == null ? "null" : value.getClass().getSimpleName() + "(" + value + ")";
    }
}
