package io.ration.cost;

public record Recommendation(String type, String impact, double savings, String description, String implementation) {
}
