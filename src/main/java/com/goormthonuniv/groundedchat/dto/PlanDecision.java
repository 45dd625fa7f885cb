package com.goormthonuniv.groundedchat.dto;

public record PlanDecision(
        Tool tool,
        String query
) {
    public enum Tool { WEB_SEARCH, NONE }

    public static PlanDecision none() { return new PlanDecision(Tool.NONE, ""); }

    public boolean isWebSearch() { return tool == Tool.WEB_SEARCH; }
}
