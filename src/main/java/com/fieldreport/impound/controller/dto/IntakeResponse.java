package com.fieldreport.impound.controller.dto;

import com.fieldreport.impound.model.IntakeReceipt;
import com.fieldreport.impound.model.NotificationOutcome;

public record IntakeResponse(
    InspectionView inspection,
    NotificationOutcome notification,
    String message
) {
    public static IntakeResponse from(IntakeReceipt receipt) {
        return new IntakeResponse(InspectionView.from(receipt.inspection()), receipt.notification(), receipt.message());
    }
}
