package com.codeassist.bot.intent;

/**
 * Outcome of free-form intent classification together with the rule and the
 * table entry that decided it.
 */
public record IntentMatch(Rule rule, String matchedTerm) {
    public enum Rule {
        CREATOR_QUESTION,
        SYNTAX,
        VOCABULARY,
        CONCEPT_WITH_CODE_NOUN,
        CONCEPT_QUESTION,
        NO_SIGNAL
    }

    public boolean isCreatorQuestion() {
        return rule == Rule.CREATOR_QUESTION;
    }

    public boolean isBuildRequest() {
        return switch (rule) {
            case SYNTAX, VOCABULARY, CONCEPT_WITH_CODE_NOUN -> true;
            case CREATOR_QUESTION, CONCEPT_QUESTION, NO_SIGNAL -> false;
        };
    }

    public Intent intent() {
        return isBuildRequest() ? Intent.GENERAL : Intent.ASK;
    }
}
