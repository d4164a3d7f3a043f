package com.ai.scheduler.component;

import com.ai.scheduler.config.BusinessRules;
import org.springframework.stereotype.Component;

import java.time.DayOfWeek;
import java.time.format.TextStyle;
import java.util.Locale;
import java.util.stream.Collectors;

@Component
public class ResponsePhrases {

    private final BusinessRules rules;

    public ResponsePhrases(BusinessRules rules) {
        this.rules = rules;
    }

    public String greeting() {
        return "Hello! I can book, reschedule, cancel or list your appointments. What would you like to do?";
    }

    public String smalltalk() {
        return "I'm doing well, thanks for asking! Shall we find a time for an appointment?";
    }

    public String outOfScope() {
        return "Sorry, I can only help with scheduling. Try something like \"Book a meeting tomorrow at 10am\".";
    }

    public String clarify() {
        return "Sorry, I didn't quite get that. You can say things like \"Book a dentist appointment on Friday at 3pm\" "
                + "or \"Cancel my meeting tomorrow\".";
    }

    public String askDateAndTime() {
        return "Sure. Which day and time would you like? For example \"tomorrow at 2pm\".";
    }

    public String noAppointments() {
        return "You don't have any appointments yet.";
    }

    public String noAppointmentsOn(String date) {
        return "You have nothing booked on " + date + ".";
    }

    public String listHeader(int count) {
        return "You have " + count + (count == 1 ? " appointment:" : " appointments:");
    }

    public String listLine(String title, String when, String end) {
        return "- " + title + ", " + when + " to " + end;
    }

    public String booked(String title, String when, String end) {
        return "Done! \"" + title + "\" is booked for " + when + " to " + end + ".";
    }

    public String confirmed(String title, String when, String end) {
        return "Great, \"" + title + "\" is booked for " + when + " to " + end + ".";
    }

    public String conflictOffer(String conflicts, String when, String end) {
        return "That time overlaps with " + conflicts + ". The next free slot that day is " + when + " to " + end
                + ". Would you like that instead?";
    }

    public String noAlternative(String conflicts, String date) {
        return "That time overlaps with " + conflicts + " and there's nothing else free later on " + date
                + ". Could you pick another day?";
    }

    public String declined() {
        return "No problem, I haven't booked anything. Let me know another time that suits you.";
    }

    public String slotList(String date, String slots) {
        return "Here's what's open on " + date + ": " + slots + ". Which time works for you?";
    }

    public String slotReprompt(String date, String slots) {
        return "That isn't one of the open times on " + date + ". Please pick one of: " + slots + ".";
    }

    public String slotTaken() {
        return "Sorry, that slot is no longer free. Could you choose another time?";
    }

    public String noSlotsFullyBooked(String date) {
        return "Sorry, there are no available slots on " + date + ". Try another day.";
    }

    public String noSlotsClosed(String date, String reason) {
        return "Sorry, there are no available slots on " + date + ". " + reason + " Try another day.";
    }

    public String weekend() {
        return "We only schedule on " + workingDaysText() + ".";
    }

    public String holiday() {
        return "We're closed on holidays.";
    }

    public String outsideHours() {
        return "That's outside our opening hours. We open at " + rules.getOpen() + " and every appointment must end by "
                + rules.getClose() + ".";
    }

    public String startsAfterLastSlot() {
        return "The latest appointment start is " + rules.getLastStart() + ".";
    }

    public String crossesLunch() {
        return "We're closed for lunch between " + rules.getLunchStart() + " and " + rules.getLunchEnd() + ".";
    }

    public String hoursSummary() {
        return "We're open " + workingDaysText() + ", " + rules.getOpen() + " to " + rules.getClose()
                + " (last start " + rules.getLastStart() + "), closed for lunch " + rules.getLunchStart()
                + " to " + rules.getLunchEnd() + ".";
    }

    public String ambiguous(String reference, String listing) {
        String subject = reference == null ? "which appointment you mean" : "which \"" + reference + "\" you mean";
        return "I'm not sure " + subject + ". " + listing + " Please tell me the title or the day.";
    }

    public String notFound() {
        return "You don't have any appointments to change.";
    }

    public String cancelled(String title, String when) {
        return "Cancelled \"" + title + "\" on " + when + ".";
    }

    public String rescheduled(String title, String from, String when, String end) {
        return "Moved \"" + title + "\" from " + from + " to " + when + " to " + end + ".";
    }

    public String needNewTime(String title) {
        return "When would you like to move \"" + title + "\" to? Please give a day and a time.";
    }

    public String nothingPending() {
        return "There's nothing waiting for confirmation. What would you like to schedule?";
    }

    private String workingDaysText() {
        if (rules.getWorkingDays().size() == 5 && !rules.getWorkingDays().contains(DayOfWeek.SATURDAY)
                && !rules.getWorkingDays().contains(DayOfWeek.SUNDAY)) {
            return "Monday to Friday";
        }
        return rules.getWorkingDays().stream()
                .sorted()
                .map(d -> d.getDisplayName(TextStyle.FULL, Locale.ENGLISH))
                .collect(Collectors.joining(", "));
    }
}
