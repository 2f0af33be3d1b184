package com.codeassist.bot.intent;

import java.util.Arrays;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Lookup tables for {@link IntentClassifier}. All tables are matched against
 * text lowercased with {@code Locale.ROOT}, so English entries are written in
 * lower case and Bengali entries are unaffected.
 */
public final class IntentPatterns {
    private static final String WORD_EDGE_BEFORE = "(?<![\\p{L}\\p{N}])";
    private static final String WORD_EDGE_AFTER = "(?![\\p{L}\\p{N}])";
    private static final String PLURAL_SUFFIX = "(?:s|es)?";

    public record Term(String term, Pattern pattern) {
        public boolean matches(String folded) {
            return pattern.matcher(folded).find();
        }
    }

    static final List<String> CREATOR_PHRASES = List.of(
            "who created", "who developed", "who made", "who built", "created by", "developed by",
            "কে তৈরি", "কে বানিয়েছে", "কে ডেভেলপ", "কে বানায়", "তৈরি করেছে", "তৈরি করছে"
    );

    static final List<String> SYNTAX_FRAGMENTS = List.of(
            "def ", "function ", "class ", "import ", "return ", "#include",
            "if(", "else:", "for(", "while(", "try:", "except:",
            "{", "}", "()", "[]", "==", "!=", "&&", "||", "=>", "//", "/**",
            "<html>", "<div>", "<script>", "public class", "private ",
            "const ", "let ", "var ", "async ", "await "
    );

    static final List<Term> ENGLISH_VOCABULARY = wordTerms(
            "code", "program", "function", "class", "variable", "algorithm",
            "python", "javascript", "java", "html", "css", "react", "node",
            "app", "website", "database", "api", "framework", "library",
            "build", "develop", "write", "generate", "make",
            "flutter", "android", "ios", "machine learning", "ai", "ml",
            "django", "flask", "fastapi", "express", "vue", "angular",
            "mongodb", "postgresql", "mysql", "firebase", "aws", "docker",
            "kubernetes", "microservice", "blockchain", "web3", "smart contract",
            // inflections the plural suffix does not cover
            "coding", "coded", "coder", "programming", "programmer", "developer", "developing",
            "development", "building", "built", "writing", "written", "generating", "making",
            "libraries"
    );

    static final List<String> BENGALI_VOCABULARY = List.of(
            "কোড", "প্রোগ্রাম", "ফাংশন", "ক্লাস", "ভেরিয়েবল", "অ্যালগরিদম",
            "পাইথন", "জাভাস্ক্রিপ্ট", "জাভা", "এইচটিএমএল", "সিএসএস",
            "অ্যাপ", "ওয়েবসাইট", "ডাটাবেস", "এপিআই", "ফ্রেমওয়ার্ক",
            "বানাও", "বানানো", "লিখে দাও", "ডেভেলপ",
            "ফ্লাটার", "অ্যান্ড্রয়েড", "আইওএস", "মেশিন লার্নিং", "এআই",
            "জ্যাঙ্গো", "ফ্লাস্ক", "এক্সপ্রেস", "অ্যাঙ্গুলার",
            "মঙ্গোডিবি", "পোস্টগ্রেস", "মাইএসকিউএল", "ফায়ারবেস",
            "ডকার", "কুবারনেটিস", "মাইক্রোসার্ভিস", "ব্লকচেইন"
    );

    static final List<Term> ENGLISH_CONCEPT_PHRASES = wordTerms(
            "what is", "explain", "meaning", "definition", "why", "how does", "difference", "compare"
    );

    static final List<String> BENGALI_CONCEPT_PHRASES = List.of(
            "কি", "কাকে বলে", "বুঝিয়ে", "সংজ্ঞা", "কেন", "কিভাবে কাজ করে", "পার্থক্য", "তুলনা"
    );

    static final List<Term> ENGLISH_CODE_NOUNS = wordTerms("function", "algorithm", "program", "script");

    static final List<String> BENGALI_CODE_NOUNS = List.of("ফাংশন", "অ্যালগরিদম", "প্রোগ্রাম", "স্ক্রিপ্ট");

    private IntentPatterns() {
    }

    /**
     * Compiles a whole-word pattern: the term must not touch another letter or
     * digit on either side, inner spaces match any run of whitespace and a
     * plural suffix is tolerated.
     */
    public static Pattern compileWordPattern(String term) {
        String trimmed = term == null ? "" : term.trim();
        if (trimmed.isEmpty()) {
            return Pattern.compile("$a");
        }
        StringBuilder regex = new StringBuilder(WORD_EDGE_BEFORE);
        String[] words = trimmed.split("\\s+");
        for (int index = 0; index < words.length; index++) {
            if (index > 0) {
                regex.append("\\s+");
            }
            regex.append(Pattern.quote(words[index]));
        }
        regex.append(PLURAL_SUFFIX).append(WORD_EDGE_AFTER);
        return Pattern.compile(regex.toString(), Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);
    }

    private static List<Term> wordTerms(String... terms) {
        return Arrays.stream(terms)
                .map(term -> new Term(term, compileWordPattern(term)))
                .toList();
    }
}
