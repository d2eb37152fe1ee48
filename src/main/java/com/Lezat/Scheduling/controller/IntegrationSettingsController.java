package com.Lezat.Scheduling.controller;

import com.Lezat.Scheduling.controller.dto.TranscriptionDtos;
import com.Lezat.Scheduling.exception.NotFoundException;
import com.Lezat.Scheduling.repository.UserRepository;
import com.Lezat.Scheduling.service.settings.IntegrationSettings;
import com.Lezat.Scheduling.service.settings.UserSettingsStore;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/integrations")
@RequiredArgsConstructor
public class IntegrationSettingsController {

    private final UserRepository userRepository;
    private final UserSettingsStore settingsStore;

    @GetMapping("/{clientReferenceId}/settings")
    public TranscriptionDtos.SettingsView getSettings(@PathVariable("clientReferenceId") String clientReferenceId) {
        if (!userRepository.existsByClientReferenceId(clientReferenceId)) {
            throw new NotFoundException("User not found: " + clientReferenceId);
        }
        IntegrationSettings s = settingsStore.load(clientReferenceId);
        TranscriptionDtos.SettingsView view = new TranscriptionDtos.SettingsView();
        view.setClientReferenceId(clientReferenceId);
        view.setAutosyncEnabled(s.autosyncEnabled());
        view.setTimezone(s.timezone().getId());
        view.setFirefliesApiKeyConfigured(s.firefliesApiKey() != null);
        view.setReadAiApiKeyConfigured(s.readAiApiKey() != null);
        view.setNotionConfigured(s.notion() != null);
        view.setNotionDatabaseId(s.notion() == null ? null : s.notion().databaseId());
        view.setMondayConfigured(s.monday() != null);
        view.setMondayBoardId(s.monday() == null ? null : s.monday().boardId());
        view.setGoogleCalendarConfigured(s.googleCalendar() != null);
        view.setGoogleCalendarId(s.googleCalendar() == null ? null : s.googleCalendar().calendarId());
        view.setOutlookCalendarConfigured(s.outlookCalendar() != null);
        return view;
    }
}
