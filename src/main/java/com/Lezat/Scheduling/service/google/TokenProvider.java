package com.Lezat.Scheduling.service.google;

import com.Lezat.Scheduling.exception.DispatchException;
import com.Lezat.Scheduling.service.settings.IntegrationSettings;

/** OAuth access tokens for a user's Google Calendar connection. */
public interface TokenProvider {

    String accessToken(IntegrationSettings.GoogleCalendarSettings settings) throws DispatchException;

    boolean canRefresh(IntegrationSettings.GoogleCalendarSettings settings);

    String refreshAccessToken(IntegrationSettings.GoogleCalendarSettings settings) throws DispatchException;
}
