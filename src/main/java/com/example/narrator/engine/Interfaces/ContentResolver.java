package com.example.narrator.engine.Interfaces;

import com.example.narrator.dto.ResolvedContent;
import com.example.narrator.util.SourceType;

public interface ContentResolver {
    boolean supports(SourceType sourceType);

    ResolvedContent resolve(String sourceRef);
}
