package com.Lezat.Scheduling.service.outlook;

import com.Lezat.Scheduling.exception.DispatchException;
import com.Lezat.Scheduling.service.settings.IntegrationSettings;

/** OAuth access tokens for a user's Microsoft 365 calendar connection. */
public interface OutlookTokenProvider {

    String accessToken(IntegrationSettings.OutlookCalendarSettings settings) throws DispatchException;

    boolean canRefresh(IntegrationSettings.OutlookCalendarSettings settings);

    String refreshAccessToken(IntegrationSettings.OutlookCalendarSettings settings) throws DispatchException;
}
