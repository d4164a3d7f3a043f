package com.ai.scheduler.service;

import com.ai.scheduler.conversation.Intent;
import com.ai.scheduler.conversation.ParsedRequest;
import com.ai.scheduler.dto.ExtractedFields;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class UtteranceParserTest {

    /** Monday 09:00. */
    private static final LocalDateTime NOW = LocalDateTime.of(2026, 3, 2, 9, 0);
    private static final LocalDate TOMORROW = LocalDate.of(2026, 3, 3);

    private ExternalParser external;
    private UtteranceParser parser;

    @BeforeEach
    void setUp() {
        external = mock(ExternalParser.class);
        when(external.extract(anyString(), any())).thenReturn(Optional.empty());
        parser = new UtteranceParser(new IntentClassifier(), new YesNoClassifier(), new DateTimeExtractor(), external);
    }

    private ParsedRequest parse(String text) {
        return parser.parse(text, NOW, false);
    }

    @Nested
    @DisplayName("booking requests")
    class Booking {

        @Test
        void fullRequestWithTitleAndDuration() {
            ParsedRequest r = parse("Book a dentist appointment for tomorrow at 3pm for 1 hour");

            assertThat(r.getIntent()).isEqualTo(Intent.CREATE);
            assertThat(r.getDate()).isEqualTo(TOMORROW);
            assertThat(r.getTime()).isEqualTo(LocalTime.of(15, 0));
            assertThat(r.getDurationMinutes()).isEqualTo(60);
            assertThat(r.getTitle()).isEqualTo("dentist appointment");
            assertThat(r.getSource()).isEqualTo(ParsedRequest.Source.RULES);
        }

        @Test
        void holidayDateWithoutTimeIsDateOnly() {
            ParsedRequest r = parse("Schedule a meeting on July 4th");

            assertThat(r.getIntent()).isEqualTo(Intent.DATE_ONLY_CREATE);
            assertThat(r.getDate()).isEqualTo(LocalDate.of(2026, 7, 4));
            assertThat(r.getTime()).isNull();
            assertThat(r.getTitle()).isEqualTo("meeting");
        }

        @Test
        void monthDayRollsIntoNextYearOncePassed() {
            ParsedRequest r = parser.parse("July 4th", LocalDateTime.of(2026, 8, 1, 9, 0), false);

            assertThat(r.getIntent()).isEqualTo(Intent.DATE_ONLY_CREATE);
            assertThat(r.getDate()).isEqualTo(LocalDate.of(2027, 7, 4));
        }

        @Test
        void numericDateWithTime() {
            ParsedRequest r = parse("12/31/2026 at 2pm");

            assertThat(r.getIntent()).isEqualTo(Intent.CREATE);
            assertThat(r.getDate()).isEqualTo(LocalDate.of(2026, 12, 31));
            assertThat(r.getTime()).isEqualTo(LocalTime.of(14, 0));
        }

        @Test
        void timeWithoutDateMeansToday() {
            ParsedRequest r = parse("10:30 for 30 minutes");

            assertThat(r.getIntent()).isEqualTo(Intent.CREATE);
            assertThat(r.getDate()).isEqualTo(NOW.toLocalDate());
            assertThat(r.getTime()).isEqualTo(LocalTime.of(10, 30));
            assertThat(r.getDurationMinutes()).isEqualTo(30);
            assertThat(r.getTitle()).isEqualTo("appointment");
        }

        @Test
        void availabilityQuestionIsDateOnly() {
            ParsedRequest r = parse("What's available on Friday?");

            assertThat(r.getIntent()).isEqualTo(Intent.DATE_ONLY_CREATE);
            assertThat(r.getDate()).isEqualTo(LocalDate.of(2026, 3, 6));
        }

        @Test
        void bookingWithoutDateOrTimeIsUnknown() {
            ParsedRequest r = parse("I want to book a haircut");

            assertThat(r.getIntent()).isEqualTo(Intent.UNKNOWN);
            assertThat(r.getTitle()).isEqualTo("haircut");
        }

        @Test
        void durationLongerThanADayIsNotGuessed() {
            assertThat(parse("book a meeting tomorrow at 10am for 2000 minutes").getIntent()).isEqualTo(Intent.UNKNOWN);
        }

        @ParameterizedTest
        @ValueSource(strings = {"schedule a meeting to discuss the move on friday at 10am",
                "book a call to change my password tomorrow at 2pm",
                "book a meeting to delete old files tomorrow at 2pm"})
        void leadingBookingVerbWinsOverLaterChangeWords(String text) {
            ParsedRequest r = parse(text);

            assertThat(r.getIntent()).isEqualTo(Intent.CREATE);
            assertThat(r.getTitle()).isIn("meeting", "call");
        }

        @Test
        void titleFromForPhraseWhenVerbObjectIsGeneric() {
            assertThat(parse("book an appointment for a haircut tomorrow at 10am").getTitle()).isEqualTo("haircut");
        }
    }

    @Nested
    @DisplayName("triage")
    class Triage {

        @ParameterizedTest
        @ValueSource(strings = {"hi", "Hello!", "good morning", "hey there"})
        void greetings(String text) {
            assertThat(parse(text).getIntent()).isEqualTo(Intent.GREETING);
        }

        @ParameterizedTest
        @ValueSource(strings = {"how are you doing", "thanks a lot", "thank you"})
        void smalltalk(String text) {
            assertThat(parse(text).getIntent()).isEqualTo(Intent.SMALLTALK);
        }

        @ParameterizedTest
        @ValueSource(strings = {"what's the weather like", "tell me a joke", "who won the football game yesterday?",
                "bananas"})
        void outOfScope(String text) {
            assertThat(parse(text).getIntent()).isEqualTo(Intent.OUT_OF_SCOPE);
        }

        @Test
        void blankIsUnknown() {
            assertThat(parse("   ").getIntent()).isEqualTo(Intent.UNKNOWN);
            assertThat(parse(null).getIntent()).isEqualTo(Intent.UNKNOWN);
        }

        @ParameterizedTest
        @ValueSource(strings = {"what do I have tomorrow", "show my appointments", "list my meetings"})
        void list(String text) {
            assertThat(parse(text).getIntent()).isEqualTo(Intent.LIST);
        }

        @Test
        void listKeepsTheDateItNames() {
            assertThat(parse("what do I have tomorrow").getDate()).isEqualTo(TOMORROW);
        }
    }

    @Nested
    @DisplayName("cancel and reschedule")
    class Changes {

        @Test
        void cancelWithReferenceAndDate() {
            ParsedRequest r = parse("Cancel my meeting tomorrow");

            assertThat(r.getIntent()).isEqualTo(Intent.CANCEL);
            assertThat(r.getReference()).isEqualTo("meeting");
            assertThat(r.getReferenceDate()).isEqualTo(TOMORROW);
        }

        @Test
        void genericReferenceMatchesAnything() {
            assertThat(parse("cancel my appointment").getReference()).isNull();
            assertThat(parse("cancel").getIntent()).isEqualTo(Intent.CANCEL);
        }

        @Test
        void rescheduleSplitsReferenceFromTarget() {
            ParsedRequest r = parse("Reschedule my dentist appointment to Friday at 4pm");

            assertThat(r.getIntent()).isEqualTo(Intent.RESCHEDULE);
            assertThat(r.getReference()).isEqualTo("dentist appointment");
            assertThat(r.getReferenceDate()).isNull();
            assertThat(r.getDate()).isEqualTo(LocalDate.of(2026, 3, 6));
            assertThat(r.getTime()).isEqualTo(LocalTime.of(16, 0));
        }

        @Test
        void rescheduleReferenceDateComesBeforeTo() {
            ParsedRequest r = parse("move tomorrow's standup to 2pm");

            assertThat(r.getIntent()).isEqualTo(Intent.RESCHEDULE);
            assertThat(r.getReference()).isEqualTo("standup");
            assertThat(r.getReferenceDate()).isEqualTo(TOMORROW);
            assertThat(r.getDate()).isNull();
            assertThat(r.getTime()).isEqualTo(LocalTime.of(14, 0));
        }
    }

    @Nested
    @DisplayName("pending replies")
    class Pending {

        @Test
        void bareYesAndNo() {
            assertThat(parser.parse("yes", NOW, true).getIntent()).isEqualTo(Intent.CONFIRM_YES);
            assertThat(parser.parse("no thanks", NOW, true).getIntent()).isEqualTo(Intent.CONFIRM_NO);
            assertThat(parser.parse("cancel", NOW, true).getIntent()).isEqualTo(Intent.CONFIRM_NO);
        }

        @Test
        void yesWithoutPendingIsStillTagged() {
            assertThat(parse("yes").getIntent()).isEqualTo(Intent.CONFIRM_YES);
        }

        @Test
        void bareTimeIsSlotChoice() {
            ParsedRequest r = parser.parse("let's do 2pm", NOW, true);

            assertThat(r.getIntent()).isEqualTo(Intent.SLOT_CHOICE);
            assertThat(r.getTime()).isEqualTo(LocalTime.of(14, 0));
        }

        @ParameterizedTest
        @ValueSource(strings = {"how about 2pm", "2pm please", "at 2pm", "ok 2pm then", "14:00 for 30 minutes"})
        void timeWithFillerIsSlotChoice(String text) {
            assertThat(parser.parse(text, NOW, true).getIntent()).isEqualTo(Intent.SLOT_CHOICE);
        }

        @Test
        void timedBookingWithoutDateIsANewRequest() {
            ParsedRequest r = parser.parse("book a dentist appointment at 3pm", NOW, true);

            assertThat(r.getIntent()).isEqualTo(Intent.CREATE);
            assertThat(r.getDate()).isEqualTo(NOW.toLocalDate());
            assertThat(r.getTime()).isEqualTo(LocalTime.of(15, 0));
            assertThat(r.getTitle()).isEqualTo("dentist appointment");
        }

        @Test
        void titleNounWithTimeIsANewRequest() {
            assertThat(parser.parse("haircut at 3pm", NOW, true).getIntent()).isEqualTo(Intent.CREATE);
        }

        @Test
        void timeWithDateIsANewRequest() {
            assertThat(parser.parse("tomorrow at 2pm", NOW, true).getIntent()).isEqualTo(Intent.CREATE);
        }

        @Test
        void bareTimeWithoutPendingIsCreate() {
            assertThat(parse("2pm").getIntent()).isEqualTo(Intent.CREATE);
        }
    }

    @Nested
    @DisplayName("external parser")
    class External {

        @Test
        void completeExternalResultWins() {
            when(external.extract(anyString(), any())).thenReturn(Optional.of(
                    new ExtractedFields("board review", LocalDate.of(2026, 3, 4), LocalTime.of(11, 0), 45)));

            ParsedRequest r = parse("please set up the board review wednesday late morning");

            assertThat(r.getIntent()).isEqualTo(Intent.CREATE);
            assertThat(r.getSource()).isEqualTo(ParsedRequest.Source.EXTERNAL);
            assertThat(r.getTitle()).isEqualTo("board review");
            assertThat(r.getTime()).isEqualTo(LocalTime.of(11, 0));
            assertThat(r.getDurationMinutes()).isEqualTo(45);
        }

        @Test
        void incompleteExternalResultFallsBackToRules() {
            when(external.extract(anyString(), any())).thenReturn(Optional.of(
                    new ExtractedFields("review", LocalDate.of(2026, 3, 4), null, 30)));

            ParsedRequest r = parse("book a review tomorrow at 10am");

            assertThat(r.getSource()).isEqualTo(ParsedRequest.Source.RULES);
            assertThat(r.getDate()).isEqualTo(TOMORROW);
            assertThat(r.getTime()).isEqualTo(LocalTime.of(10, 0));
        }

        @Test
        void failingExternalParserNeverBreaksParsing() {
            when(external.extract(anyString(), any())).thenThrow(new IllegalStateException("boom"));

            ParsedRequest r = parse("book a review tomorrow at 10am");

            assertThat(r.getIntent()).isEqualTo(Intent.CREATE);
            assertThat(r.getSource()).isEqualTo(ParsedRequest.Source.RULES);
        }

        @Test
        void notConsultedForNonBookingTurns() {
            parse("hello");
            parse("cancel my meeting");

            verify(external, never()).extract(anyString(), any());
        }
    }
}
