package com.Lezat.Scheduling.service.transcript;

import com.Lezat.Scheduling.model.TranscriptionRecord;
import com.Lezat.Scheduling.service.fireflies.FirefliesClient;
import com.Lezat.Scheduling.service.readai.ReadAiClient;
import com.Lezat.Scheduling.service.settings.IntegrationSettings;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Optional;

@Component
@RequiredArgsConstructor
public class TranscriptFetcherRegistry {

    private final FirefliesClient firefliesClient;
    private final ReadAiClient readAiClient;

    public Optional<TranscriptFetcher> forProvider(TranscriptionRecord.Provider provider) {
        if (provider == null) return Optional.empty();
        return switch (provider) {
            case FIREFLIES -> Optional.of(firefliesClient);
            case READ_AI -> Optional.of(readAiClient);
        };
    }

    /** Present only when the provider can fetch transcripts with the given user's credentials. */
    public Optional<TranscriptFetcher> configuredFor(TranscriptionRecord.Provider provider,
                                                     IntegrationSettings settings) {
        return forProvider(provider).filter(f -> f.isConfigured(settings));
    }
}
