package ru.tigran.churnpredictor.dto;

/**
 * Output of the scoring rules: one of three fixed probabilities with its explanation.
 */
public record ChurnScore(double probability, String reason) {
}
