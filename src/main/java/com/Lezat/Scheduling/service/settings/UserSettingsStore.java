package com.Lezat.Scheduling.service.settings;

public interface UserSettingsStore {

    /** Never returns null: users without a settings row get defaults (autosync on, nothing configured). */
    IntegrationSettings load(String clientReferenceId);
}
