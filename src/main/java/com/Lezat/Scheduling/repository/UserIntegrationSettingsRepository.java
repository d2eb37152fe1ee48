package com.Lezat.Scheduling.repository;

import com.Lezat.Scheduling.model.UserIntegrationSettings;
import org.springframework.data.jpa.repository.JpaRepository;

public interface UserIntegrationSettingsRepository extends JpaRepository<UserIntegrationSettings, String> {
}
