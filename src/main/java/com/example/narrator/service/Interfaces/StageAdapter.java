package com.example.narrator.service.Interfaces;

import com.example.narrator.service.StageContext;
import com.example.narrator.util.Stage;

/**
 * One pipeline step: a typed input in, a typed output out. Implementations throw on failure; the
 * orchestrator names the stage in the error it reports.
 */
public interface StageAdapter<I, O> {
    Stage stage();

    O execute(I input, StageContext context);
}
