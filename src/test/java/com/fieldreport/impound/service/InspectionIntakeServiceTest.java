package com.fieldreport.impound.service;

import com.fieldreport.impound.config.AppMetrics;
import com.fieldreport.impound.exception.InvalidFormException;
import com.fieldreport.impound.exception.StoreUnavailableException;
import com.fieldreport.impound.model.Inspection;
import com.fieldreport.impound.model.InspectionStatus;
import com.fieldreport.impound.model.IntakeReceipt;
import com.fieldreport.impound.model.NewInspection;
import com.fieldreport.impound.model.NotificationOutcome;
import com.fieldreport.impound.model.Operator;
import com.fieldreport.impound.model.QuantityRepresentation;
import com.fieldreport.impound.repository.InspectionRepository;
import com.fieldreport.impound.service.notification.NotificationDispatcher;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.mockito.ArgumentCaptor;
import org.springframework.dao.DataAccessResourceFailureException;

import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

class InspectionIntakeServiceTest {

    private InspectionRepository inspectionRepository;
    private NotificationDispatcher dispatcher;
    private AppMetrics metrics;
    private InspectionIntakeService service;

    @BeforeEach
    void setUp() {
        inspectionRepository = mock(InspectionRepository.class);
        dispatcher = mock(NotificationDispatcher.class);
        metrics = new AppMetrics(new SimpleMeterRegistry());
        service = new InspectionIntakeService(inspectionRepository, dispatcher, metrics, Duration.ofMillis(200));

        when(inspectionRepository.insert(any())).thenAnswer(inv -> {
            Inspection draft = inv.getArgument(0);
            return draft.toBuilder().id("insp-1").build();
        });
        when(dispatcher.dispatchImpound(any(), any()))
                .thenReturn(CompletableFuture.completedFuture(NotificationOutcome.sent()));
    }

    @Test
    void submit_storesAndNotifiesContacts() {
        IntakeReceipt receipt = service.submit(form(12, "+256700000001, 0772000002, +256700000001", true),
                new Operator("uid-1", "officer@example.org", null));

        assertEquals("Report submitted and SMS sent.", receipt.message());
        assertEquals("insp-1", receipt.inspection().getId());

        ArgumentCaptor<Inspection> stored = ArgumentCaptor.forClass(Inspection.class);
        verify(inspectionRepository).insert(stored.capture());
        Inspection draft = stored.getValue();
        assertEquals(12, draft.getBoxesImpounded());
        assertEquals(12, draft.getInitialBoxes());
        assertEquals(InspectionStatus.SUBMITTED, draft.getStatus());
        assertEquals(QuantityRepresentation.NUMERIC, draft.getBoxesRepresentation());
        assertEquals("officer@example.org", draft.getCreatedBy());
        assertEquals(List.of("+256700000001", "0772000002", "+256700000001"), draft.getDrugshopContactPhones());

        verify(dispatcher).dispatchImpound(any(), eq(Set.of("+256700000001", "0772000002")));
        assertEquals(1.0, metrics.getInspectionsCreatedCounter().count());
    }

    @Test
    void submit_textBoxCount_keepsRepresentation() {
        IntakeReceipt receipt = service.submit(form("7", "0772000002", true), null);

        assertEquals(QuantityRepresentation.TEXT, receipt.inspection().getBoxesRepresentation());
        assertEquals("7", receipt.inspection().boxesImpoundedValue());
        assertEquals(Operator.ANONYMOUS_UID, receipt.inspection().getCreatedBy());
    }

    @Test
    void submit_smsFailure_stillStoresReport() {
        when(dispatcher.dispatchImpound(any(), any()))
                .thenReturn(CompletableFuture.completedFuture(NotificationOutcome.failed("SMS failed (500): Unknown error")));

        IntakeReceipt receipt = service.submit(form(3, "0772000002", true), null);

        assertEquals("Report submitted. SMS delivery failed, please retry later.", receipt.message());
        verify(inspectionRepository).insert(any());
    }

    @Test
    void submit_smsNotRequested_skipsDispatch() {
        IntakeReceipt receipt = service.submit(form(3, "", false), null);

        assertEquals("Inspection report submitted!", receipt.message());
        assertEquals(NotificationOutcome.Status.SKIPPED, receipt.notification().status());
        verifyNoInteractions(dispatcher);
    }

    @Test
    void submit_zeroBoxes_needsNoPhones() {
        IntakeReceipt receipt = service.submit(form(0, null, true), null);

        assertEquals("Inspection report submitted!", receipt.message());
        verifyNoInteractions(dispatcher);
    }

    @Test
    void submit_smsRequestedWithoutPhones_isInvalid() {
        InvalidFormException e = assertThrows(InvalidFormException.class,
                () -> service.submit(form(3, " , ", true), null));

        assertThat(e.getFieldErrors()).containsEntry("drugshopContactPhones", "Enter at least one phone number");
        verifyNoInteractions(inspectionRepository);
    }

    @Test
    void submit_badContactPhone_namesIt() {
        InvalidFormException e = assertThrows(InvalidFormException.class,
                () -> service.submit(form(3, "0772000002, 12ab", true), null));

        assertThat(e.getFieldErrors()).containsEntry("drugshopContactPhones", "Invalid phone: 12ab");
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "abc", "-3", "2.5", "99999999999"})
    void validate_rejectsBadBoxCounts(String raw) {
        Map<String, String> errors = new LinkedHashMap<>();

        assertNull(service.validate(form(raw, "0772000002", true), errors));
        assertThat(errors).containsKey("boxesImpounded");
    }

    @Test
    void validate_acceptsWholeNumbers() {
        Map<String, String> errors = new LinkedHashMap<>();

        assertEquals(4, service.validate(form(4.0, "0772000002", true), errors));
        assertEquals(4, service.validate(form(4L, "0772000002", true), errors));
        assertEquals(4, service.validate(form(" 4 ", "0772000002", true), errors));
        assertThat(errors).isEmpty();
        assertNull(service.validate(form(Double.NaN, "0772000002", true), errors));
    }

    @Test
    void validate_requiredFields() {
        NewInspection blank = new NewInspection(null, " ", null, "bad phone", null, 1, "", null, false);
        Map<String, String> errors = new LinkedHashMap<>();

        service.validate(blank, errors);

        assertThat(errors).containsKeys("serialNumber", "drugshopName", "impoundedBy", "clientTelephone");
    }

    @Test
    void submit_overlongFields_areFormErrors() {
        String manyPhones = String.join(", ", Collections.nCopies(80, "+256700000001"));
        NewInspection overlong = new NewInspection(Instant.now(), "S".repeat(129), "D".repeat(256), null,
                manyPhones, 3, "Officer Okello", "A".repeat(513), true);

        InvalidFormException e = assertThrows(InvalidFormException.class, () -> service.submit(overlong, null));

        assertThat(e.getFieldErrors())
                .containsEntry("serialNumber", "Must be at most 128 characters")
                .containsEntry("drugshopName", "Must be at most 255 characters")
                .containsEntry("locationAddress", "Must be at most 512 characters")
                .containsEntry("drugshopContactPhones", "Must be at most 1024 characters")
                .doesNotContainKey("impoundedBy");
        verifyNoInteractions(inspectionRepository, dispatcher);
    }

    @Test
    void submit_storeDown_isUnavailable() {
        doThrow(new DataAccessResourceFailureException("down")).when(inspectionRepository).insert(any());

        assertThrows(StoreUnavailableException.class, () -> service.submit(form(3, "0772000002", true), null));
        verifyNoInteractions(dispatcher);
    }

    private static NewInspection form(Object boxes, String phones, boolean sendSms) {
        return new NewInspection(Instant.now(), "SN-100", "Mukono Drugshop", null, phones, boxes,
                "Officer Okello", "Plot 4, Mukono", sendSms);
    }
}
