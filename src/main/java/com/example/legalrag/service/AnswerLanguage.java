package com.example.legalrag.service;

import java.util.Locale;

/** Localized strings of the answerer, keyed by ISO language code. */
public enum AnswerLanguage {

    RO("Romanian", "Întrebare", "Nu știu. Nu am suficiente informații din contextul recuperat."),
    EN("English", "Question", "I don't know. There is not enough information in the retrieved context.");

    private final String displayName;
    private final String questionLabel;
    private final String abstention;

    AnswerLanguage(String displayName, String questionLabel, String abstention) {
        this.displayName = displayName;
        this.questionLabel = questionLabel;
        this.abstention = abstention;
    }

    public String displayName() {
        return displayName;
    }

    public String questionLabel() {
        return questionLabel;
    }

    public String abstention() {
        return abstention;
    }

    /** Unknown codes fall back to Romanian. */
    public static AnswerLanguage fromCode(String code) {
        if (code == null) return RO;
        return switch (code.trim().toLowerCase(Locale.ROOT)) {
            case "en", "eng" -> EN;
            default -> RO;
        };
    }
}
