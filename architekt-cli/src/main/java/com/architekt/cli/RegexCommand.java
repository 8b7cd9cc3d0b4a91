package com.architekt.cli;

import com.architekt.core.attribute.CharacterClass;
import com.architekt.core.attribute.RegexBuilder;
import com.architekt.core.attribute.RegexOptions;
import picocli.CommandLine.ArgGroup;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

import java.util.EnumSet;
import java.util.Set;
import java.util.concurrent.Callable;

/**
 * Command to build a regex constraint from character options and a length rule.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * # ^[a-z0-9]{3,8}$
 * architekt regex --lower --digits --min 3 --max 8
 *
 * # ^[A-Fa-f0-9]{6}$
 * architekt regex --hex --exact 6
 * }</pre>
 */
@Command(
    name = "regex",
    description = "Build a regex pattern from character options",
    mixinStandardHelpOptions = true
)
public class RegexCommand implements Callable<Integer> {

    @Spec
    private CommandSpec spec;

    @Option(names = {"--lower"}, description = "Allow lowercase letters a-z")
    private boolean lowercase;

    @Option(names = {"--upper"}, description = "Allow uppercase letters A-Z")
    private boolean uppercase;

    @Option(names = {"--digits"}, description = "Allow digits 0-9")
    private boolean digits;

    @Option(names = {"--hex"}, description = "Allow hexadecimal characters")
    private boolean hexadecimal;

    @Option(names = {"--ascii"}, description = "Allow printable ASCII characters")
    private boolean printableAscii;

    @ArgGroup(exclusive = true)
    private LengthRule length;

    static class LengthRule {

        @Option(names = {"--exact"}, description = "Exact length")
        String exact;

        @ArgGroup(exclusive = false)
        Range range;
    }

    static class Range {

        @Option(names = {"--min"}, description = "Minimum length (default: 0)")
        String min;

        @Option(names = {"--max"}, description = "Maximum length (default: unbounded)")
        String max;
    }

    @Override
    public Integer call() {
        String pattern = RegexBuilder.build(options());
        spec.commandLine().getOut().println(pattern);
        return ExitCodes.OK;
    }

    private RegexOptions options() {
        Set<CharacterClass> classes = EnumSet.noneOf(CharacterClass.class);
        if (lowercase) {
            classes.add(CharacterClass.LOWERCASE);
        }
        if (uppercase) {
            classes.add(CharacterClass.UPPERCASE);
        }
        if (digits) {
            classes.add(CharacterClass.DIGITS);
        }
        if (hexadecimal) {
            classes.add(CharacterClass.HEXADECIMAL);
        }
        if (printableAscii) {
            classes.add(CharacterClass.PRINTABLE_ASCII);
        }

        if (length == null) {
            return RegexOptions.unbounded(classes);
        }
        if (length.exact != null) {
            return RegexOptions.exact(classes, length.exact);
        }
        return RegexOptions.range(classes, length.range.min, length.range.max);
    }
}
