package com.voiceflow.domain.workflow.model;

public record Transcription(String text, double confidence) {}
