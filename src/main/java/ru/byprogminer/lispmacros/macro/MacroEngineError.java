package ru.byprogminer.lispmacros.macro;

/**
 * Defect in the expansion engine itself, as opposed to an error in the program being expanded.
 */
public class MacroEngineError extends IllegalStateException {

    public MacroEngineError(String message) {
        super(message);
    }
}
