package ru.tigran.churnpredictor.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;

/**
 * Zero-shot classification response: labels and their scores in matching order.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ZeroShotResult(String sequence, List<String> labels, List<Double> scores) {
}
