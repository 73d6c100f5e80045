/*
 * VisionCorrect — Refractive Pre-Correction Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.visioncorrect.core.exceptions;

/**
 * Structurally invalid input: missing image or prescription, non-positive size,
 * non-finite optics parameters. The call is aborted.
 */
public class InvalidInputException extends RuntimeException {
    public InvalidInputException(String message) {
        super("Invalid input: " + message);
    }

    public InvalidInputException(String message, Throwable cause) {
        super("Invalid input: " + message, cause);
    }
}
