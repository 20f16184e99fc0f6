package io.ration.cost;

/** USD per thousand input and output tokens. */
public record ModelPrice(double inputPer1k, double outputPer1k) {
    public double inputCost(TokenUsage tokens) { return tokens.input() / 1000.0 * inputPer1k; }

    public double outputCost(TokenUsage tokens) { return tokens.output() / 1000.0 * outputPer1k; }

    public double cost(TokenUsage tokens) { return inputCost(tokens) + outputCost(tokens); }
}
