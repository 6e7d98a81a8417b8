package com.fieldreport.impound.service.notification;

import com.fieldreport.impound.model.Inspection;
import com.fieldreport.impound.model.ReleaseRecord;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.Locale;

/**
 * Renders the texts sent to drugshop owners.
 */
@Component
public class SmsMessageFormatter {

    static final String DEFAULT_SHOP_NAME = "Drugshop";
    static final String MISSING_SERIAL = "—";

    private final DateTimeFormatter whenFormat;

    public SmsMessageFormatter(@Value("${app.notification.zone:Africa/Kampala}") String zone) {
        this.whenFormat = DateTimeFormatter.ofPattern("dd MMM yyyy, HH:mm", Locale.ENGLISH).withZone(ZoneId.of(zone));
    }

    public String releaseMessage(Inspection inspection, ReleaseRecord release) {
        return "Dear " + shopName(inspection) + ", "
                + release.getQuantity() + " box(es) have been released on " + when(release.getReleaseDate()) + ". "
                + "Serial: " + orDefault(inspection.getSerialNumber(), MISSING_SERIAL) + ". "
                + "Remaining: " + release.getRemainingAfter() + ". "
                + "Officer: " + release.getReleasedBy() + ".";
    }

    public String impoundMessage(Inspection inspection) {
        return "Dear " + shopName(inspection) + ", "
                + inspection.getBoxesImpounded() + " box(es) were impounded on " + when(inspection.getInspectionDate()) + ". "
                + "Serial: " + inspection.getSerialNumber() + ". "
                + "Officer: " + inspection.getImpoundedBy() + ".";
    }

    String when(Instant instant) {
        return whenFormat.format(instant == null ? Instant.now() : instant);
    }

    private static String shopName(Inspection inspection) {
        return orDefault(inspection.getDrugshopName(), DEFAULT_SHOP_NAME);
    }

    private static String orDefault(String value, String fallback) {
        return value == null || value.isBlank() ? fallback : value;
    }
}
