package com.fieldreport.impound.model;

public record IntakeReceipt(
    Inspection inspection,
    NotificationOutcome notification,
    String message
) {}
