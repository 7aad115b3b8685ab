package com.codeharness.core.language;

import java.nio.file.Path;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Infers a source file's language from its extension, falling back to content markers.
 */
public class LanguageDetector {

    private static final Map<String, Language> EXTENSIONS = Map.ofEntries(
            Map.entry(".cpp", Language.CPP),
            Map.entry(".cc", Language.CPP),
            Map.entry(".cxx", Language.CPP),
            Map.entry(".c++", Language.CPP),
            Map.entry(".h", Language.CPP),
            Map.entry(".hpp", Language.CPP),
            Map.entry(".hxx", Language.CPP),
            Map.entry(".py", Language.PYTHON),
            Map.entry(".pyw", Language.PYTHON),
            Map.entry(".java", Language.JAVA)
    );

    private static final Map<Language, List<Pattern>> MARKERS = new EnumMap<>(Map.of(
            Language.CPP, List.of(
                    Pattern.compile("#include\\s*[<\"]"),
                    Pattern.compile("using\\s+namespace\\s+std"),
                    Pattern.compile("std::\\w+"),
                    Pattern.compile("int\\s+main\\s*\\("),
                    Pattern.compile("class\\s+\\w+\\s*\\{")),
            Language.PYTHON, List.of(
                    Pattern.compile("def\\s+\\w+\\s*\\("),
                    Pattern.compile("import\\s+\\w+"),
                    Pattern.compile("from\\s+\\w+\\s+import"),
                    Pattern.compile("if\\s+__name__\\s*==\\s*[\"']__main__[\"']"),
                    Pattern.compile("print\\s*\\(")),
            Language.JAVA, List.of(
                    Pattern.compile("public\\s+class\\s+\\w+"),
                    Pattern.compile("public\\s+static\\s+void\\s+main"),
                    Pattern.compile("import\\s+java\\."),
                    Pattern.compile("package\\s+\\w+"),
                    Pattern.compile("System\\.out\\.print"))
    ));

    /**
     * Maps a file name or path to a language by extension (case-insensitive).
     *
     * @return the language, or {@link Language#UNKNOWN}
     */
    public Language detectFromExtension(String fileName) {
        if (fileName == null) {
            return Language.UNKNOWN;
        }
        String name = fileName.toLowerCase(Locale.ROOT);
        int dot = name.lastIndexOf('.');
        if (dot < 0 || dot < Math.max(name.lastIndexOf('/'), name.lastIndexOf('\\'))) {
            return Language.UNKNOWN;
        }
        return EXTENSIONS.getOrDefault(name.substring(dot), Language.UNKNOWN);
    }

    /**
     * Scores every language by how many of its markers occur in {@code content}.
     * When {@code hintExtension} maps to a language whose markers match at all, that language wins.
     *
     * @return the best-scoring language, or {@link Language#UNKNOWN} when nothing matches
     */
    public Language detectFromContent(String content, String hintExtension) {
        if (content == null || content.isBlank()) {
            return Language.UNKNOWN;
        }
        if (hintExtension != null) {
            String hint = hintExtension.startsWith(".") ? hintExtension : "." + hintExtension;
            Language hinted = detectFromExtension(hint);
            if (hinted.isKnown() && score(hinted, content) > 0) {
                return hinted;
            }
        }
        Language best = Language.UNKNOWN;
        int bestScore = 0;
        for (Language language : List.of(Language.CPP, Language.PYTHON, Language.JAVA)) {
            int score = score(language, content);
            if (score > bestScore) {
                best = language;
                bestScore = score;
            }
        }
        return best;
    }

    /**
     * Extension first, then content. Either argument may be {@code null}.
     */
    public Language detect(Path path, String content) {
        if (path != null) {
            Language byExtension = detectFromExtension(path.getFileName().toString());
            if (byExtension.isKnown()) {
                return byExtension;
            }
        }
        return detectFromContent(content, null);
    }

    private int score(Language language, String content) {
        int score = 0;
        for (Pattern marker : MARKERS.getOrDefault(language, List.of())) {
            if (marker.matcher(content).find()) {
                score++;
            }
        }
        return score;
    }
}
