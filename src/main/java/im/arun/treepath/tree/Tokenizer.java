package im.arun.treepath.tree;

import im.arun.treepath.util.TreeUtils;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Splits raw terminal text into lowercase sub-tokens on underscores and camel-case
 * boundaries, e.g. {@code getHTTPResponse_code -> get|http|response|code}.
 */
public class Tokenizer {

    // lower->Upper, or Upper->Upper followed by lower
    private static final Pattern CAMEL_CASE = Pattern.compile(
        ".+?(?:(?<=[a-z])(?=[A-Z])|(?<=[A-Z])(?=[A-Z][a-z])|$)", Pattern.UNIX_LINES);

    private Tokenizer() {
    }

    public static String tokenize(String term) {
        List<String> blocks = new ArrayList<>();
        for (String underscoreBlock : term.split("_", -1)) {
            blocks.addAll(camelCaseSplit(underscoreBlock));
        }

        List<String> lowered = new ArrayList<>(blocks.size());
        for (String block : blocks) {
            lowered.add(block.toLowerCase(Locale.ROOT));
        }
        return String.join(TreeUtils.SEPARATOR, lowered);
    }

    static List<String> camelCaseSplit(String identifier) {
        List<String> parts = new ArrayList<>();
        Matcher matcher = CAMEL_CASE.matcher(identifier);
        while (matcher.find()) {
            parts.add(matcher.group());
        }
        return parts;
    }
}
