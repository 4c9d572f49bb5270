package com.ai.clinic.calendar;

import com.ai.clinic.config.ClinicProperties;
import com.ai.clinic.config.GoogleCalendarProperties;
import com.ai.clinic.exception.ErrorKind;
import com.ai.clinic.exception.SchedulingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.boot.test.web.client.MockServerRestTemplateCustomizer;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.hamcrest.Matchers.startsWith;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.content;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.jsonPath;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.queryParam;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class GoogleCalendarClientTest {

    private static final ZoneOffset IST = ZoneOffset.ofHoursMinutes(5, 30);
    private static final String API = "https://calendar.test/v3";
    private static final String TOKEN_URI = "https://oauth.test/token";

    private static final GoogleCalendarProperties PROPERTIES = new GoogleCalendarProperties(
            true, "clinic@group.calendar.google.com", "client-id", "client-secret", "refresh-token", TOKEN_URI, API);

    private MockRestServiceServer server;
    private GoogleCalendarClient client;
    private SettableClock clock;

    @BeforeEach
    void setUp() {
        MockServerRestTemplateCustomizer customizer = new MockServerRestTemplateCustomizer();
        clock = new SettableClock(Instant.parse("2025-08-20T04:30:00Z"));
        client = new GoogleCalendarClient(new RestTemplateBuilder(customizer), new ObjectMapper(),
                PROPERTIES, ClinicProperties.defaults(), clock);
        server = customizer.getServer();
    }

    @Test
    void listsEventsWithRefreshedToken() {
        expectToken();
        server.expect(requestTo(startsWith(API + "/calendars/clinic@group.calendar.google.com/events?")))
                .andExpect(method(HttpMethod.GET))
                .andExpect(header("Authorization", "Bearer access-1"))
                .andExpect(queryParam("timeMin", "2025-08-21T04:30:00Z"))
                .andExpect(queryParam("timeMax", "2025-08-21T05:00:00Z"))
                .andExpect(queryParam("singleEvents", "true"))
                .andRespond(withSuccess("""
                        {"items": [
                          {"id": "e1", "summary": "Checkup",
                           "start": {"dateTime": "2025-08-21T10:00:00+05:30"},
                           "end": {"dateTime": "2025-08-21T10:30:00+05:30"}},
                          {"id": "e2", "summary": "Holiday",
                           "start": {"date": "2025-08-21"}, "end": {"date": "2025-08-22"}}
                        ]}
                        """, MediaType.APPLICATION_JSON));

        List<CalendarEvent> events = client.listEvents(at(10, 0), at(10, 30));

        assertThat(events).hasSize(2);
        assertThat(events.get(0).isTimed()).isTrue();
        assertThat(events.get(0).start()).isEqualTo(at(10, 0));
        assertThat(events.get(1).isTimed()).isFalse();
        server.verify();
    }

    @Test
    void reusesTokenUntilExpiry() {
        expectToken();
        server.expect(requestTo(startsWith(API))).andRespond(withSuccess("{\"items\": []}", MediaType.APPLICATION_JSON));
        server.expect(requestTo(startsWith(API))).andRespond(withSuccess("{}", MediaType.APPLICATION_JSON));

        assertThat(client.listEvents(at(10, 0), at(10, 30))).isEmpty();
        assertThat(client.listEvents(at(11, 0), at(11, 30))).isEmpty();
        server.verify();
    }

    @Test
    void refreshesTokenOnceItExpires() {
        expectToken();
        server.expect(requestTo(startsWith(API))).andRespond(withSuccess("{\"items\": []}", MediaType.APPLICATION_JSON));
        expectToken();
        server.expect(requestTo(startsWith(API))).andRespond(withSuccess("{\"items\": []}", MediaType.APPLICATION_JSON));

        assertThat(client.listEvents(at(10, 0), at(10, 30))).isEmpty();
        clock.advance(Duration.ofMinutes(59).plusSeconds(40));
        assertThat(client.listEvents(at(11, 0), at(11, 30))).isEmpty();
        server.verify();
    }

    @Test
    void createsEventInClinicTimeZone() {
        expectToken();
        server.expect(requestTo(API + "/calendars/clinic@group.calendar.google.com/events"))
                .andExpect(method(HttpMethod.POST))
                .andExpect(jsonPath("$.summary").value("Dental appointment - Cleaning"))
                .andExpect(jsonPath("$.start.dateTime").value("2025-08-21T10:00:00+05:30"))
                .andExpect(jsonPath("$.start.timeZone").value("Asia/Kolkata"))
                .andExpect(jsonPath("$.end.dateTime").value("2025-08-21T10:30:00+05:30"))
                .andRespond(withSuccess("{\"id\": \"new-1\"}", MediaType.APPLICATION_JSON));

        String id = client.createEvent("Dental appointment - Cleaning", "Patient: Asha Rao (user_id: asha@example.com)",
                at(10, 0), at(10, 30), "Asia/Kolkata");

        assertThat(id).isEqualTo("new-1");
        server.verify();
    }

    @Test
    void updateKeepsExistingFieldsAndMovesTimes() {
        expectToken();
        server.expect(requestTo(API + "/calendars/clinic@group.calendar.google.com/events/e1"))
                .andExpect(method(HttpMethod.GET))
                .andRespond(withSuccess("""
                        {"id": "e1", "summary": "Dental appointment - Checkup",
                         "start": {"dateTime": "2025-08-21T10:00:00+05:30"},
                         "end": {"dateTime": "2025-08-21T10:30:00+05:30"}}
                        """, MediaType.APPLICATION_JSON));
        server.expect(requestTo(API + "/calendars/clinic@group.calendar.google.com/events/e1"))
                .andExpect(method(HttpMethod.PUT))
                .andExpect(jsonPath("$.summary").value("Dental appointment - Checkup"))
                .andExpect(jsonPath("$.start.dateTime").value("2025-08-22T15:00:00+05:30"))
                .andRespond(withSuccess("{\"id\": \"e1\"}", MediaType.APPLICATION_JSON));

        String id = client.updateEvent("e1",
                OffsetDateTime.of(2025, 8, 22, 15, 0, 0, 0, IST), OffsetDateTime.of(2025, 8, 22, 15, 30, 0, 0, IST));

        assertThat(id).isEqualTo("e1");
        server.verify();
    }

    @Test
    void deletingMissingEventIsNotAnError() {
        expectToken();
        server.expect(requestTo(API + "/calendars/clinic@group.calendar.google.com/events/gone"))
                .andExpect(method(HttpMethod.DELETE))
                .andRespond(withStatus(HttpStatus.GONE));

        assertThatCode(() -> client.deleteEvent("gone")).doesNotThrowAnyException();
        server.verify();
    }

    @Test
    void serverErrorBecomesCalendarUnavailable() {
        expectToken();
        server.expect(requestTo(API + "/calendars/clinic@group.calendar.google.com/events/e1"))
                .andRespond(withStatus(HttpStatus.INTERNAL_SERVER_ERROR));

        assertThatThrownBy(() -> client.deleteEvent("e1"))
                .isInstanceOfSatisfying(SchedulingException.class,
                        e -> assertThat(e.getKind()).isEqualTo(ErrorKind.CALENDAR_UNAVAILABLE));
    }

    @Test
    void rejectedRefreshTokenBecomesCalendarUnavailable() {
        server.expect(requestTo(TOKEN_URI)).andRespond(withStatus(HttpStatus.UNAUTHORIZED));

        assertThatThrownBy(() -> client.listEvents(at(10, 0), at(10, 30)))
                .isInstanceOf(SchedulingException.class)
                .hasMessageContaining("token refresh failed");
    }

    @Test
    void missingCredentialsFailWithoutCallingGoogle() {
        MockServerRestTemplateCustomizer customizer = new MockServerRestTemplateCustomizer();
        GoogleCalendarClient unconfigured = new GoogleCalendarClient(new RestTemplateBuilder(customizer), new ObjectMapper(),
                new GoogleCalendarProperties(true, null, "", "", "", null, null), ClinicProperties.defaults(), clock);

        assertThatThrownBy(() -> unconfigured.listEvents(at(10, 0), at(10, 30)))
                .isInstanceOf(SchedulingException.class)
                .hasMessageContaining("not configured");
        customizer.getServer().verify();
    }

    private void expectToken() {
        server.expect(requestTo(TOKEN_URI))
                .andExpect(method(HttpMethod.POST))
                .andExpect(content().formDataContains(Map.of(
                        "grant_type", "refresh_token",
                        "refresh_token", "refresh-token")))
                .andRespond(withSuccess("{\"access_token\": \"access-1\", \"expires_in\": 3599}",
                        MediaType.APPLICATION_JSON));
    }

    private static OffsetDateTime at(int hour, int minute) {
        return OffsetDateTime.of(2025, 8, 21, hour, minute, 0, 0, IST);
    }

    private static final class SettableClock extends Clock {

        private Instant now;

        SettableClock(Instant now) {
            this.now = now;
        }

        void advance(Duration duration) {
            now = now.plus(duration);
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return now;
        }
    }
}
