package com.raditha.inductive.cli;

import com.raditha.inductive.model.MalformedAbstractionException;
import com.raditha.inductive.model.VariantLog;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads a plain-text trace list into a variant log.
 * <p>
 * One trace per line, activities separated by commas. A line may start with a multiplicity
 * such as {@code 3: a, b, c}. {@code <>} stands for the empty trace. Blank lines and lines
 * starting with {@code #} are ignored.
 */
public class TraceFileReader {

    private static final Pattern MULTIPLICITY = Pattern.compile("^(\\d+)\\s*:(.*)$");
    static final String EMPTY_TRACE = "<>";

    private TraceFileReader() {
    }

    public static VariantLog read(Path file) throws IOException {
        return parse(Files.readAllLines(file, StandardCharsets.UTF_8));
    }

    /**
     * @throws MalformedAbstractionException naming the offending line
     */
    public static VariantLog parse(List<String> lines) {
        VariantLog.Builder builder = VariantLog.builder();
        for (int i = 0; i < lines.size(); i++) {
            String line = lines.get(i).trim();
            if (line.isEmpty() || line.startsWith("#")) {
                continue;
            }
            int count = 1;
            Matcher matcher = MULTIPLICITY.matcher(line);
            if (matcher.matches()) {
                try {
                    count = Integer.parseInt(matcher.group(1));
                } catch (NumberFormatException e) {
                    throw new MalformedAbstractionException("Line " + (i + 1) + ": multiplicity too large");
                }
                if (count == 0) {
                    throw new MalformedAbstractionException("Line " + (i + 1) + ": multiplicity must be positive");
                }
                line = matcher.group(2).trim();
            }
            builder.add(parseTrace(line, i + 1), count);
        }
        return builder.build();
    }

    private static List<String> parseTrace(String body, int lineNumber) {
        if (body.equals(EMPTY_TRACE)) {
            return List.of();
        }
        List<String> trace = new ArrayList<>();
        for (String part : body.split(",", -1)) {
            String activity = part.trim();
            if (activity.isEmpty()) {
                throw new MalformedAbstractionException("Line " + lineNumber + ": empty activity label");
            }
            trace.add(activity);
        }
        return trace;
    }
}
