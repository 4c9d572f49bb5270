package com.ai.clinic.component;

import com.ai.clinic.dto.SlotView;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.stream.Collectors;

@Component
public class ResponsePhrases {

    public String bookingConfirmed(String name, String date, String time, String reason) {
        return "Appointment booked! Name: " + name + ", date: " + date + ", time: " + time + ", reason: " + reason
                + ". Your appointment is confirmed on " + date + " at " + time
                + " and has been added to the clinic's calendar.";
    }

    public String slotTaken(String name, String date, String time, List<SlotView> alternatives) {
        String opening = "Sorry " + name + ", the slot on " + date + " at " + time + " is already booked.";
        return opening + " " + alternativesSentence(alternatives);
    }

    public String slotNotAvailable(String date, String time, List<SlotView> alternatives) {
        return "The requested time slot on " + date + " at " + time + " is NOT available. "
                + alternativesSentence(alternatives);
    }

    private String alternativesSentence(List<SlotView> alternatives) {
        if (alternatives.isEmpty()) {
            return "I couldn't find another free time close to it. Would you like to try a different date?";
        }
        return "The nearest free times are " + joinLabels(alternatives) + ". Would any of these work for you?";
    }

    public String slotAvailable(String date, String time) {
        return "The requested time slot on " + date + " at " + time + " is available for booking.";
    }

    public String outsideHours(String date, String time) {
        return "Sorry, " + date + " at " + time + " is outside our working hours. We're open 09:00 AM to 01:00 PM "
                + "and 02:00 PM to 06:00 PM, and every 30-minute appointment has to finish before lunch or closing. "
                + "Please choose another time.";
    }

    public String rescheduled(String previous, String next, String reason) {
        return "Your appointment has been rescheduled. Previous: " + previous + ". New: " + next
                + ". Reason: " + reason + ".";
    }

    public String cancelled(String date, String time) {
        return "Alright, your appointment on " + date + " at " + time + " is cancelled. Let us know if you need anything else.";
    }

    public String upcomingAppointment(String name, String date, String time, String reason) {
        return "Your next appointment is for " + name + " on " + date + " at " + time + " (" + reason + ").";
    }

    public String noUpcomingAppointment() {
        return "I couldn't find any upcoming confirmed appointment for that email. "
                + "Please check the email address you used when booking.";
    }

    public String preferencesUpdated() {
        return "Got it, I've saved your preferences for next time.";
    }

    public String nothingToUpdate() {
        return "I didn't catch which preference you'd like me to remember. Could you tell me again?";
    }

    public String noProfile() {
        return "I don't have a profile for that email yet. Your preferences will be saved once you book an appointment.";
    }

    public String noPreferences() {
        return "You haven't told us any preferences yet.";
    }

    public String preferencesFound() {
        return "Here are the preferences we have on file for you.";
    }

    public String moderationWarning() {
        return "Let's keep our conversation respectful, please. I'm happy to help with your dental appointments.";
    }

    public String moderationFinalWarning() {
        return "This is a final warning. Please keep the conversation respectful, or I'll have to end this chat.";
    }

    public String conversationLocked() {
        return "This conversation has been locked due to repeated violations. Please contact the clinic directly.";
    }

    public String sessionReset() {
        return "Your conversation has been reset. How can I help you today?";
    }

    public String noBookingInSession() {
        return "No appointment has been booked in this conversation yet.";
    }

    public String lastBooking(String name, String date, String time) {
        return "The last appointment in this conversation is for " + name + " on " + date + " at " + time + ".";
    }

    public String unknownOperation(String operation) {
        return "Sorry, I don't know how to handle the request '" + operation + "'.";
    }

    public String failed(String action, String detail) {
        return "Sorry, I couldn't " + action + " due to an internal error: " + detail;
    }

    private static String joinLabels(List<SlotView> slots) {
        List<String> labels = slots.stream().map(SlotView::label).collect(Collectors.toList());
        if (labels.size() == 1) return labels.get(0);
        return String.join(", ", labels.subList(0, labels.size() - 1)) + " or " + labels.get(labels.size() - 1);
    }
}
