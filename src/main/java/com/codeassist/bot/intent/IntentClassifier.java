package com.codeassist.bot.intent;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Rule-based classifier for free-form messages. Rules are evaluated in a fixed
 * order and the first one that fires decides:
 * <ol>
 *     <li>creator-identity question: never a build request</li>
 *     <li>programming syntax fragment: build request</li>
 *     <li>programming vocabulary: build request</li>
 *     <li>concept question: build request only if it names a code noun</li>
 *     <li>otherwise a general question</li>
 * </ol>
 */
public class IntentClassifier {

    public IntentMatch classify(String text) {
        String folded = fold(text);

        Optional<String> creator = firstSubstring(IntentPatterns.CREATOR_PHRASES, folded);
        if (creator.isPresent()) {
            return new IntentMatch(IntentMatch.Rule.CREATOR_QUESTION, creator.get());
        }
        Optional<String> syntax = firstSubstring(IntentPatterns.SYNTAX_FRAGMENTS, folded);
        if (syntax.isPresent()) {
            return new IntentMatch(IntentMatch.Rule.SYNTAX, syntax.get());
        }
        Optional<String> vocabulary = firstWord(IntentPatterns.ENGLISH_VOCABULARY, folded)
                .or(() -> firstSubstring(IntentPatterns.BENGALI_VOCABULARY, folded));
        if (vocabulary.isPresent()) {
            return new IntentMatch(IntentMatch.Rule.VOCABULARY, vocabulary.get());
        }
        Optional<String> concept = firstWord(IntentPatterns.ENGLISH_CONCEPT_PHRASES, folded)
                .or(() -> firstSubstring(IntentPatterns.BENGALI_CONCEPT_PHRASES, folded));
        if (concept.isPresent()) {
            Optional<String> codeNoun = firstWord(IntentPatterns.ENGLISH_CODE_NOUNS, folded)
                    .or(() -> firstSubstring(IntentPatterns.BENGALI_CODE_NOUNS, folded));
            return codeNoun
                    .map(noun -> new IntentMatch(IntentMatch.Rule.CONCEPT_WITH_CODE_NOUN, noun))
                    .orElseGet(() -> new IntentMatch(IntentMatch.Rule.CONCEPT_QUESTION, concept.get()));
        }
        return new IntentMatch(IntentMatch.Rule.NO_SIGNAL, null);
    }

    public boolean isCreatorQuestion(String text) {
        return firstSubstring(IntentPatterns.CREATOR_PHRASES, fold(text)).isPresent();
    }

    public boolean isBuildRequest(String text) {
        return classify(text).isBuildRequest();
    }

    /**
     * Lowercases with the root locale, strips surrounding whitespace and appends
     * a single space so fragments such as {@code "def "} also match at the end
     * of the message.
     */
    static String fold(String text) {
        if (text == null) {
            return " ";
        }
        return text.strip().toLowerCase(Locale.ROOT) + " ";
    }

    private static Optional<String> firstSubstring(List<String> fragments, String folded) {
        return fragments.stream().filter(folded::contains).findFirst();
    }

    private static Optional<String> firstWord(List<IntentPatterns.Term> terms, String folded) {
        return terms.stream().filter(term -> term.matches(folded)).map(IntentPatterns.Term::term).findFirst();
    }
}
