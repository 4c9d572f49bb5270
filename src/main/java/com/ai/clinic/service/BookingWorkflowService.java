package com.ai.clinic.service;

import com.ai.clinic.calendar.CalendarClient;
import com.ai.clinic.component.ResponsePhrases;
import com.ai.clinic.component.SessionBookingStore;
import com.ai.clinic.config.ClinicProperties;
import com.ai.clinic.dto.AppointmentView;
import com.ai.clinic.dto.BookingRequest;
import com.ai.clinic.dto.ContactRequest;
import com.ai.clinic.dto.LastBooking;
import com.ai.clinic.dto.PreferencesPatch;
import com.ai.clinic.dto.RescheduleRequest;
import com.ai.clinic.dto.SlotCheckRequest;
import com.ai.clinic.dto.SlotView;
import com.ai.clinic.dto.WorkflowResponse;
import com.ai.clinic.dto.WorkflowStatus;
import com.ai.clinic.entity.StoredAppointment;
import com.ai.clinic.entity.UserPreferences;
import com.ai.clinic.entity.UserProfile;
import com.ai.clinic.exception.SchedulingException;
import com.ai.clinic.time.SlotInterval;
import com.ai.clinic.time.TemporalNormalizer;
import com.ai.clinic.time.WorkingHoursPolicy;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Book, reschedule, cancel and look up appointments, plus the preference
 * operations. Every operation returns a {@link WorkflowResponse}; failures are
 * reported in it rather than thrown, and nothing is retried here.
 */
@Service
public class BookingWorkflowService {

    private static final Logger log = LoggerFactory.getLogger(BookingWorkflowService.class);

    static final String DEFAULT_REASON = "Dental appointment";

    private final TemporalNormalizer normalizer;
    private final WorkingHoursPolicy workingHoursPolicy;
    private final AvailabilityService availabilityService;
    private final AlternativeSlotService alternativeSlotService;
    private final CalendarClient calendarClient;
    private final AppointmentService appointmentService;
    private final UserProfileService userProfileService;
    private final ContactValidator contactValidator;
    private final SessionBookingStore sessionBookingStore;
    private final ResponsePhrases phrases;
    private final ClinicProperties clinicProperties;

    public BookingWorkflowService(TemporalNormalizer normalizer,
                                  WorkingHoursPolicy workingHoursPolicy,
                                  AvailabilityService availabilityService,
                                  AlternativeSlotService alternativeSlotService,
                                  CalendarClient calendarClient,
                                  AppointmentService appointmentService,
                                  UserProfileService userProfileService,
                                  ContactValidator contactValidator,
                                  SessionBookingStore sessionBookingStore,
                                  ResponsePhrases phrases,
                                  ClinicProperties clinicProperties) {
        this.normalizer = normalizer;
        this.workingHoursPolicy = workingHoursPolicy;
        this.availabilityService = availabilityService;
        this.alternativeSlotService = alternativeSlotService;
        this.calendarClient = calendarClient;
        this.appointmentService = appointmentService;
        this.userProfileService = userProfileService;
        this.contactValidator = contactValidator;
        this.sessionBookingStore = sessionBookingStore;
        this.phrases = phrases;
        this.clinicProperties = clinicProperties;
    }

    // =========================================================
    // BOOK
    // =========================================================
    public WorkflowResponse book(String sessionId, BookingRequest request) {
        return guarded("book your appointment", () -> doBook(sessionId, request));
    }

    private WorkflowResponse doBook(String sessionId, BookingRequest request) {
        String name = contactValidator.requireName(request.getName());
        String userId = contactValidator.normalizeEmail(request.getEmail());
        String phone = contactValidator.normalizePhone(request.getPhone());

        LocalDate date = normalizer.normalizeDate(request.getDate());
        String time = normalizer.normalizeTime(request.getTime());
        SlotInterval slot = normalizer.resolveInterval(date, time);
        String dateText = TemporalNormalizer.formatDate(date);

        if (!workingHoursPolicy.allows(slot)) {
            return WorkflowResponse.of(WorkflowStatus.OUTSIDE_HOURS, phrases.outsideHours(dateText, time));
        }

        if (!availabilityService.isFree(slot)) {
            List<SlotView> alternatives = alternativesFor(slot, null);
            log.info("Slot {} {} taken for {}, offering {} alternative(s)", dateText, time, userId, alternatives.size());
            return WorkflowResponse.unavailable(phrases.slotTaken(name, dateText, time, alternatives), alternatives);
        }

        String reason = StringUtils.defaultIfBlank(request.getReason(), DEFAULT_REASON).trim();
        String eventId = calendarClient.createEvent(
                "Dental appointment - " + reason,
                "Patient: " + name + " (user_id: " + userId + ")",
                slot.start(),
                slot.end(),
                clinicProperties.safeZoneId());

        StoredAppointment appointment = StoredAppointment.builder()
                .id(UUID.randomUUID().toString())
                .userId(userId)
                .patientName(name)
                .reason(reason)
                .startTime(slot.start().toInstant())
                .endTime(slot.end().toInstant())
                .calendarEventId(eventId)
                .status(StoredAppointment.Status.CONFIRMED)
                .build();
        appointment = appointmentService.save(appointment);

        userProfileService.recordBooking(userId, name, phone, request.toPreferencesPatch());

        sessionBookingStore.record(sessionId, lastBooking(appointment, phone));
        log.info("Booked appointment {}: patient={} user={} date={} time={}",
                appointment.getId(), name, userId, dateText, time);

        return WorkflowResponse.of(WorkflowStatus.CONFIRMED,
                phrases.bookingConfirmed(name, dateText, time, reason),
                Map.of(WorkflowResponse.APPOINTMENT, view(appointment)));
    }

    // =========================================================
    // CHECK SLOT
    // =========================================================
    public WorkflowResponse checkSlot(SlotCheckRequest request) {
        return guarded("check the slot", () -> {
            LocalDate date = normalizer.normalizeDate(request.getDate());
            String time = normalizer.normalizeTime(request.getTime());
            SlotInterval slot = normalizer.resolveInterval(date, time);
            String dateText = TemporalNormalizer.formatDate(date);

            if (!workingHoursPolicy.allows(slot)) {
                return WorkflowResponse.of(WorkflowStatus.OUTSIDE_HOURS, phrases.outsideHours(dateText, time));
            }
            if (availabilityService.isFree(slot)) {
                return WorkflowResponse.of(WorkflowStatus.AVAILABLE, phrases.slotAvailable(dateText, time));
            }
            List<SlotView> alternatives = alternativesFor(slot, null);
            return WorkflowResponse.unavailable(phrases.slotNotAvailable(dateText, time, alternatives), alternatives);
        });
    }

    // =========================================================
    // RESCHEDULE
    // =========================================================
    public WorkflowResponse reschedule(String sessionId, RescheduleRequest request) {
        return guarded("reschedule your appointment", () -> doReschedule(sessionId, request));
    }

    private WorkflowResponse doReschedule(String sessionId, RescheduleRequest request) {
        String userId = contactValidator.normalizeEmail(request.getEmail());

        Optional<StoredAppointment> existingOpt = appointmentService.findNearestUpcomingConfirmed(userId);
        if (existingOpt.isEmpty()) {
            return WorkflowResponse.of(WorkflowStatus.NOT_FOUND, phrases.noUpcomingAppointment());
        }
        StoredAppointment existing = existingOpt.get();

        LocalDate date = normalizer.normalizeDate(request.getNewDate());
        String time = normalizer.normalizeTime(request.getNewTime());
        SlotInterval slot = normalizer.resolveInterval(date, time);
        String dateText = TemporalNormalizer.formatDate(date);

        if (!workingHoursPolicy.allows(slot)) {
            return WorkflowResponse.of(WorkflowStatus.OUTSIDE_HOURS, phrases.outsideHours(dateText, time));
        }

        // the appointment's own event never blocks its new slot
        if (!availabilityService.isFree(slot, existing.getCalendarEventId())) {
            List<SlotView> alternatives = alternativesFor(slot, existing.getCalendarEventId());
            return WorkflowResponse.unavailable(
                    phrases.slotTaken(existing.getPatientName(), dateText, time, alternatives), alternatives);
        }

        String previous = label(existing.getStartTime().atOffset(normalizer.offset()));

        existing.setStartTime(slot.start().toInstant());
        existing.setEndTime(slot.end().toInstant());

        if (StringUtils.isNotBlank(existing.getCalendarEventId())) {
            existing.setCalendarEventId(calendarClient.updateEvent(existing.getCalendarEventId(), slot.start(), slot.end()));
        } else {
            existing.setCalendarEventId(calendarClient.createEvent(
                    "Dental appointment - " + existing.getReason(),
                    "Patient: " + existing.getPatientName() + " (user_id: " + userId + ")",
                    slot.start(),
                    slot.end(),
                    clinicProperties.safeZoneId()));
        }

        StoredAppointment saved = appointmentService.save(existing);
        String phone = userProfileService.find(userId).map(UserProfile::getPhone).orElse(null);
        sessionBookingStore.record(sessionId, lastBooking(saved, phone));

        log.info("Rescheduled appointment {} for {} from {} to {}", saved.getId(), userId, previous, label(slot.start()));
        return WorkflowResponse.of(WorkflowStatus.RESCHEDULED,
                phrases.rescheduled(previous, label(slot.start()), saved.getReason()),
                Map.of(WorkflowResponse.APPOINTMENT, view(saved)));
    }

    // =========================================================
    // CANCEL
    // =========================================================
    public WorkflowResponse cancel(String sessionId, ContactRequest request) {
        return guarded("cancel your appointment", () -> {
            String userId = contactValidator.normalizeEmail(request.getEmail());

            Optional<StoredAppointment> existingOpt = appointmentService.findNearestUpcomingConfirmed(userId);
            if (existingOpt.isEmpty()) {
                return WorkflowResponse.of(WorkflowStatus.NOT_FOUND, phrases.noUpcomingAppointment());
            }
            StoredAppointment appointment = existingOpt.get();

            if (StringUtils.isNotBlank(appointment.getCalendarEventId())) {
                try {
                    calendarClient.deleteEvent(appointment.getCalendarEventId());
                } catch (RuntimeException e) {
                    log.warn("Could not delete calendar event {} for appointment {}: {}",
                            appointment.getCalendarEventId(), appointment.getId(), e.getMessage());
                }
            }

            appointment.setStatus(StoredAppointment.Status.CANCELLED);
            StoredAppointment saved = appointmentService.save(appointment);
            sessionBookingStore.forgetAppointment(sessionId, saved.getId());

            OffsetDateTime start = saved.getStartTime().atOffset(normalizer.offset());
            log.info("Cancelled appointment {} for {}", saved.getId(), userId);
            return WorkflowResponse.of(WorkflowStatus.CANCELLED,
                    phrases.cancelled(TemporalNormalizer.formatDate(start.toLocalDate()),
                            TemporalNormalizer.formatTime(start.toLocalTime())),
                    Map.of(WorkflowResponse.APPOINTMENT, view(saved)));
        });
    }

    // =========================================================
    // LOOKUP
    // =========================================================
    public WorkflowResponse lookup(ContactRequest request) {
        return guarded("look up your appointment", () -> {
            String userId = contactValidator.normalizeEmail(request.getEmail());
            return appointmentService.findNearestUpcomingConfirmed(userId)
                    .map(a -> {
                        AppointmentView view = view(a);
                        return WorkflowResponse.of(WorkflowStatus.FOUND,
                                phrases.upcomingAppointment(a.getPatientName(), view.date(), view.time(), a.getReason()),
                                Map.of(WorkflowResponse.APPOINTMENT, view));
                    })
                    .orElseGet(() -> WorkflowResponse.of(WorkflowStatus.NOT_FOUND, phrases.noUpcomingAppointment()));
        });
    }

    // =========================================================
    // PREFERENCES
    // =========================================================
    public WorkflowResponse updatePreferences(PreferencesPatch patch) {
        return guarded("save your preferences", () -> {
            String userId = contactValidator.normalizeEmail(patch.getEmail());
            if (!patch.hasChanges()) {
                return WorkflowResponse.invalid(phrases.nothingToUpdate());
            }
            return userProfileService.updatePreferences(userId, patch)
                    .map(profile -> WorkflowResponse.of(WorkflowStatus.UPDATED, phrases.preferencesUpdated(),
                            Map.of(WorkflowResponse.PREFERENCES, profile.getPreferences().asMap())))
                    .orElseGet(() -> WorkflowResponse.of(WorkflowStatus.NOT_FOUND, phrases.noProfile()));
        });
    }

    public WorkflowResponse getPreferences(ContactRequest request) {
        return guarded("read your preferences", () -> {
            String userId = contactValidator.normalizeEmail(request.getEmail());
            Optional<UserProfile> profile = userProfileService.find(userId);
            if (profile.isEmpty()) {
                return WorkflowResponse.of(WorkflowStatus.NOT_FOUND, phrases.noProfile());
            }
            UserPreferences preferences = profile.get().getPreferences();
            if (preferences.isEmpty()) {
                return WorkflowResponse.of(WorkflowStatus.NO_PREFERENCES, phrases.noPreferences());
            }
            return WorkflowResponse.of(WorkflowStatus.FOUND, phrases.preferencesFound(),
                    Map.of(WorkflowResponse.PREFERENCES, preferences.asMap()));
        });
    }

    // =========================================================
    // HELPERS
    // =========================================================
    private WorkflowResponse guarded(String action, Supplier<WorkflowResponse> operation) {
        try {
            return operation.get();
        } catch (SchedulingException e) {
            if (e.getKind().isValidation()) {
                log.info("Rejected request to {}: {} ({})", action, e.getMessage(), e.getKind());
                return WorkflowResponse.invalid(e.getMessage());
            }
            log.error("Failed to {}: {}", action, e.getMessage(), e);
            return WorkflowResponse.error(phrases.failed(action, e.getMessage()));
        } catch (RuntimeException e) {
            log.error("Failed to {}", action, e);
            return WorkflowResponse.error(phrases.failed(action, e.getMessage()));
        }
    }

    private List<SlotView> alternativesFor(SlotInterval slot, String ignoredEventId) {
        return alternativeSlotService
                .findAlternatives(slot, clinicProperties.safeMaxAlternatives(), ignoredEventId)
                .stream()
                .map(SlotView::from)
                .toList();
    }

    private AppointmentView view(StoredAppointment appointment) {
        return AppointmentView.from(appointment, normalizer.offset());
    }

    private LastBooking lastBooking(StoredAppointment appointment, String phone) {
        ZoneOffset offset = normalizer.offset();
        OffsetDateTime start = appointment.getStartTime().atOffset(offset);
        OffsetDateTime end = appointment.getEndTime().atOffset(offset);
        return new LastBooking(
                appointment.getId(),
                appointment.getPatientName(),
                TemporalNormalizer.formatDate(start.toLocalDate()),
                TemporalNormalizer.formatTime(start.toLocalTime()),
                appointment.getReason(),
                phone,
                appointment.getUserId(),
                start.format(DateTimeFormatter.ISO_OFFSET_DATE_TIME),
                end.format(DateTimeFormatter.ISO_OFFSET_DATE_TIME),
                appointment.getCalendarEventId(),
                appointment.getUserId());
    }

    private static String label(OffsetDateTime dateTime) {
        return TemporalNormalizer.formatDate(dateTime.toLocalDate()) + " at " + TemporalNormalizer.formatTime(dateTime.toLocalTime());
    }
}
