package com.regulatory.conflict.strategy;

/**
 * Raw strategy confidence adjusted by historical outcomes.
 *
 * @param raw      confidence of the selection branch alone
 * @param prior    smoothed historical success rate of the signature
 * @param weight   share given to the prior
 * @param combined {@code (1 - weight) * raw + weight * prior}
 */
public record BlendedConfidence(double raw, double prior, double weight, double combined) {
}
