package com.example.narrator.service.quality;

import com.example.narrator.dto.QualityReviewInput;
import com.example.narrator.model.QualityIssue;

import java.util.List;

/**
 * One independent rule applied to a generated script.
 */
public interface QualityCheck {
    String name();

    List<QualityIssue> inspect(QualityReviewInput input);
}
