package com.example.narrator.exception;

import com.example.narrator.model.QualityVerdict;

public class QualityRejectedException extends NarratorException {
    private final transient QualityVerdict verdict;

    public QualityRejectedException(QualityVerdict verdict) {
        super("Quality review rejected the script (score " + verdict.score() + "/100)");
        this.verdict = verdict;
    }

    public QualityVerdict getVerdict() {
        return verdict;
    }
}
