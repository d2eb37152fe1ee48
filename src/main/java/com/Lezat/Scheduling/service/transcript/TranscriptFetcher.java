package com.Lezat.Scheduling.service.transcript;

import com.Lezat.Scheduling.exception.ProviderFetchException;
import com.Lezat.Scheduling.service.settings.IntegrationSettings;

/** "Fetch transcript by meeting id" capability of a recording provider. */
public interface TranscriptFetcher {

    boolean isConfigured(IntegrationSettings settings);

    FetchedTranscript fetchTranscript(String meetingId, IntegrationSettings settings) throws ProviderFetchException;
}
