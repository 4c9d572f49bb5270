package com.ai.clinic.calendar;

import com.ai.clinic.config.ClinicProperties;
import com.ai.clinic.config.GoogleCalendarProperties;
import com.ai.clinic.exception.SchedulingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;
import java.time.Clock;
import java.time.OffsetDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;

/**
 * Google Calendar v3 over REST. Authenticates with a stored OAuth refresh token.
 */
@Component
@ConditionalOnProperty(prefix = "app.google.calendar", name = "enabled", havingValue = "true")
public class GoogleCalendarClient implements CalendarClient {

    private static final Logger log = LoggerFactory.getLogger(GoogleCalendarClient.class);

    private final RestTemplate restTemplate;
    private final ObjectMapper mapper;
    private final GoogleCalendarProperties properties;
    private final String timeZone;
    private final Clock clock;

    private String cachedAccessToken;
    private long tokenExpiresAtEpochSec;

    public GoogleCalendarClient(RestTemplateBuilder builder, ObjectMapper mapper,
                                GoogleCalendarProperties properties, ClinicProperties clinicProperties, Clock clock) {
        this.restTemplate = builder.build();
        this.clock = clock;
        this.mapper = mapper;
        this.properties = properties;
        this.timeZone = clinicProperties.safeZoneId();
    }

    @Override
    public List<CalendarEvent> listEvents(OffsetDateTime timeMin, OffsetDateTime timeMax) {
        URI uri = eventsUri()
                .queryParam("timeMin", timeMin.toInstant().toString())
                .queryParam("timeMax", timeMax.toInstant().toString())
                .queryParam("singleEvents", true)
                .queryParam("orderBy", "startTime")
                .buildAndExpand(properties.safeCalendarId())
                .encode()
                .toUri();
        try {
            ResponseEntity<JsonNode> response = restTemplate.exchange(
                    uri, HttpMethod.GET, new HttpEntity<>(authHeaders()), JsonNode.class);
            return parseEvents(response.getBody());
        } catch (RestClientException e) {
            throw SchedulingException.calendarUnavailable("Failed to list calendar events: " + e.getMessage(), e);
        }
    }

    @Override
    public String createEvent(String summary, String description, OffsetDateTime start, OffsetDateTime end, String timeZone) {
        ObjectNode body = mapper.createObjectNode();
        body.put("summary", summary);
        body.put("description", description);
        body.set("start", dateNode(start, timeZone));
        body.set("end", dateNode(end, timeZone));

        URI uri = eventsUri().buildAndExpand(properties.safeCalendarId()).encode().toUri();
        try {
            ResponseEntity<JsonNode> response = restTemplate.exchange(
                    uri, HttpMethod.POST, new HttpEntity<>(body, jsonHeaders()), JsonNode.class);
            String eventId = eventId(response.getBody());
            log.info("Created calendar event {} for {} - {}", eventId, start, end);
            return eventId;
        } catch (RestClientException e) {
            throw SchedulingException.calendarUnavailable("Failed to create calendar event: " + e.getMessage(), e);
        }
    }

    @Override
    public String updateEvent(String eventId, OffsetDateTime newStart, OffsetDateTime newEnd) {
        URI uri = eventUri(eventId);
        try {
            JsonNode existing = restTemplate.exchange(
                    uri, HttpMethod.GET, new HttpEntity<>(authHeaders()), JsonNode.class).getBody();
            ObjectNode body = existing instanceof ObjectNode node ? node : mapper.createObjectNode();
            body.set("start", dateNode(newStart, timeZone));
            body.set("end", dateNode(newEnd, timeZone));

            ResponseEntity<JsonNode> response = restTemplate.exchange(
                    uri, HttpMethod.PUT, new HttpEntity<>(body, jsonHeaders()), JsonNode.class);
            log.info("Moved calendar event {} to {} - {}", eventId, newStart, newEnd);
            return eventId(response.getBody());
        } catch (RestClientException e) {
            throw SchedulingException.calendarUnavailable("Failed to update calendar event: " + e.getMessage(), e);
        }
    }

    @Override
    public void deleteEvent(String eventId) {
        try {
            restTemplate.exchange(eventUri(eventId), HttpMethod.DELETE, new HttpEntity<>(authHeaders()), Void.class);
            log.info("Deleted calendar event {}", eventId);
        } catch (HttpClientErrorException e) {
            if (e.getStatusCode() == HttpStatus.NOT_FOUND || e.getStatusCode() == HttpStatus.GONE) {
                log.info("Calendar event {} already gone", eventId);
                return;
            }
            throw SchedulingException.calendarUnavailable("Failed to delete calendar event: " + e.getMessage(), e);
        } catch (RestClientException e) {
            throw SchedulingException.calendarUnavailable("Failed to delete calendar event: " + e.getMessage(), e);
        }
    }

    // =========================================================
    // AUTH
    // =========================================================
    private synchronized String accessToken() {
        if (!properties.isConfigured()) {
            throw SchedulingException.calendarUnavailable("Google Calendar credentials are not configured", null);
        }
        long now = clock.instant().getEpochSecond();
        if (cachedAccessToken != null && now < tokenExpiresAtEpochSec - 30) {
            return cachedAccessToken;
        }

        MultiValueMap<String, String> form = new LinkedMultiValueMap<>();
        form.add("client_id", properties.clientId());
        form.add("client_secret", properties.clientSecret());
        form.add("refresh_token", properties.refreshToken());
        form.add("grant_type", "refresh_token");

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_FORM_URLENCODED);

        try {
            JsonNode token = restTemplate.postForObject(
                    properties.safeTokenUri(), new HttpEntity<>(form, headers), JsonNode.class);
            if (token == null || StringUtils.isBlank(token.path("access_token").asText(null))) {
                throw SchedulingException.calendarUnavailable("Google token response has no access_token", null);
            }
            cachedAccessToken = token.path("access_token").asText();
            tokenExpiresAtEpochSec = now + token.path("expires_in").asLong(3600);
            return cachedAccessToken;
        } catch (RestClientException e) {
            throw SchedulingException.calendarUnavailable("Google OAuth token refresh failed: " + e.getMessage(), e);
        }
    }

    private HttpHeaders authHeaders() {
        HttpHeaders headers = new HttpHeaders();
        headers.setBearerAuth(accessToken());
        headers.setAccept(List.of(MediaType.APPLICATION_JSON));
        return headers;
    }

    private HttpHeaders jsonHeaders() {
        HttpHeaders headers = authHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        return headers;
    }

    // =========================================================
    // JSON
    // =========================================================
    private UriComponentsBuilder eventsUri() {
        return UriComponentsBuilder.fromHttpUrl(properties.safeApiBase())
                .path("/calendars/{calendarId}/events");
    }

    private URI eventUri(String eventId) {
        return UriComponentsBuilder.fromHttpUrl(properties.safeApiBase())
                .path("/calendars/{calendarId}/events/{eventId}")
                .buildAndExpand(properties.safeCalendarId(), eventId)
                .encode()
                .toUri();
    }

    private ObjectNode dateNode(OffsetDateTime dateTime, String zone) {
        ObjectNode node = mapper.createObjectNode();
        node.put("dateTime", dateTime.format(DateTimeFormatter.ISO_OFFSET_DATE_TIME));
        node.put("timeZone", StringUtils.defaultIfBlank(zone, timeZone));
        return node;
    }

    private String eventId(JsonNode body) {
        String id = body == null ? null : body.path("id").asText(null);
        if (StringUtils.isBlank(id)) {
            throw SchedulingException.calendarUnavailable("Calendar response did not include an event id", null);
        }
        return id;
    }

    List<CalendarEvent> parseEvents(JsonNode root) {
        if (root == null || !root.path("items").isArray()) {
            return List.of();
        }
        List<CalendarEvent> events = new ArrayList<>();
        for (JsonNode item : root.path("items")) {
            String id = item.path("id").asText(null);
            String summary = item.path("summary").asText("");
            String start = item.path("start").path("dateTime").asText(null);
            String end = item.path("end").path("dateTime").asText(null);
            if (start == null || end == null) {
                events.add(CalendarEvent.allDay(id, summary));
                continue;
            }
            events.add(new CalendarEvent(id, summary, OffsetDateTime.parse(start), OffsetDateTime.parse(end)));
        }
        return events;
    }
}
