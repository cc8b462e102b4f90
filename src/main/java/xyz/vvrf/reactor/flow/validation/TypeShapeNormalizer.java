package xyz.vvrf.reactor.flow.validation;

import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 类型形状字符串的规范化，用于忽略书写差异后比较两个结构类型。
 * <p>
 * 规则：去掉所有空白；{@code Array<T>} 改写为 {@code T[]}（由内向外反复应用）；
 * 去掉 {@code }} 或 {@code ]} 前多余的 {@code ;} 和 {@code ,}；统一小写。
 *
 * @author ruifeng.wen
 */
public final class TypeShapeNormalizer {

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern ARRAY_GENERIC = Pattern.compile("(?i)Array<([^<>]*)>");
    private static final Pattern TRAILING_SEPARATOR = Pattern.compile("[;,]+([}\\]])");

    private TypeShapeNormalizer() {}

    public static String normalize(String typeShape) {
        if (typeShape == null) {
            return "";
        }
        String result = WHITESPACE.matcher(typeShape).replaceAll("");
        Matcher matcher = ARRAY_GENERIC.matcher(result);
        while (matcher.find()) {
            result = matcher.replaceAll("$1[]");
            matcher = ARRAY_GENERIC.matcher(result);
        }
        result = TRAILING_SEPARATOR.matcher(result).replaceAll("$1");
        return result.toLowerCase(Locale.ROOT);
    }

    /**
     * 是否为结构类型（对象或数组形状）。
     */
    public static boolean isStructural(String typeShape) {
        String normalized = normalize(typeShape);
        return normalized.indexOf('{') >= 0 || normalized.indexOf('[') >= 0;
    }

    /**
     * 是否为不参与比较的宽松类型：未声明、any 或 unknown。
     */
    public static boolean isUntyped(String typeShape) {
        String normalized = normalize(typeShape);
        return normalized.isEmpty() || "any".equals(normalized) || "unknown".equals(normalized);
    }

    public static boolean sameShape(String first, String second) {
        return normalize(first).equals(normalize(second));
    }
}
