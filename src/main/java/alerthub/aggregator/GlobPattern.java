package alerthub.aggregator;

import com.google.common.cache.Cache;
import com.google.common.cache.CacheBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * 通配符匹配：* 任意串，? 单个字符，整串匹配，不区分大小写。
 * 空模式匹配一切；非空模式不匹配空值；无法编译的模式永不匹配。
 */
public final class GlobPattern {
    private static final Logger logger = LoggerFactory.getLogger(GlobPattern.class);

    private static final Cache<String, Optional<Pattern>> compiled = CacheBuilder.newBuilder()
            .maximumSize(1000)
            .build();

    private GlobPattern() {
    }

    public static boolean matches(String pattern, String value) {
        if (pattern == null || pattern.trim().isEmpty()) {
            return true;
        }
        if (value == null || value.isEmpty()) {
            return false;
        }
        return compile(pattern.trim())
                .map(regex -> regex.matcher(value).matches())
                .orElse(false);
    }

    static Optional<Pattern> compile(String glob) {
        try {
            return compiled.get(glob, () -> toRegex(glob));
        } catch (ExecutionException e) {
            logger.warn("通配符模式编译失败, 视为不匹配: {}", glob, e);
            return Optional.empty();
        }
    }

    private static Optional<Pattern> toRegex(String glob) {
        StringBuilder regex = new StringBuilder();
        StringBuilder literal = new StringBuilder();
        for (char c : glob.toCharArray()) {
            if (c == '*' || c == '?') {
                appendLiteral(regex, literal);
                regex.append(c == '*' ? ".*" : ".");
            } else {
                literal.append(c);
            }
        }
        appendLiteral(regex, literal);
        try {
            return Optional.of(Pattern.compile(regex.toString(),
                    Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE | Pattern.DOTALL));
        } catch (PatternSyntaxException e) {
            logger.warn("通配符模式非法, 视为不匹配: {}", glob, e);
            return Optional.empty();
        }
    }

    private static void appendLiteral(StringBuilder regex, StringBuilder literal) {
        if (literal.length() > 0) {
            regex.append(Pattern.quote(literal.toString()));
            literal.setLength(0);
        }
    }
}
