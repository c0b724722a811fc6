package com.jreinhal.legaldoc.dto;

public record AskRequest(String query, String conversationId) {
}
