package ru.tigran.churnpredictor.dto;

/**
 * One (label, score) pair returned by the sentiment classifier.
 */
public record LabelScore(String label, double score) {
}
