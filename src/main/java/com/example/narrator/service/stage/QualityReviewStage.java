package com.example.narrator.service.stage;

import com.example.narrator.dto.QualityReviewInput;
import com.example.narrator.model.QualityVerdict;
import com.example.narrator.service.Interfaces.StageAdapter;
import com.example.narrator.service.StageContext;
import com.example.narrator.service.quality.QualityGate;
import com.example.narrator.util.Stage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class QualityReviewStage implements StageAdapter<QualityReviewInput, QualityVerdict> {
    private static final Logger LOGGER = LoggerFactory.getLogger(QualityReviewStage.class);

    private final QualityGate gate;

    public QualityReviewStage(QualityGate gate) {
        this.gate = gate;
    }

    @Override
    public Stage stage() {
        return Stage.QUALITY_REVIEW;
    }

    @Override
    public QualityVerdict execute(QualityReviewInput input, StageContext context) {
        context.checkCancelled();
        QualityVerdict verdict = gate.review(input);
        LOGGER.info("Quality reviewed jobId={} score={} recommendation={} issues={} passed={}",
                context.jobId(), verdict.score(), verdict.recommendation(), verdict.issues().size(), verdict.passed());
        return verdict;
    }
}
