package com.kickoff.tipping.service;

import com.kickoff.tipping.model.AppSetting;
import com.kickoff.tipping.repository.AppSettingRepository;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.Optional;

@Service
public class SettingsService {

    public static final String LAST_SYNC_AT = "last_sync_at";
    public static final String LAST_SYNC_SUMMARY = "last_sync_summary";

    private final AppSettingRepository repository;

    public SettingsService(AppSettingRepository repository) {
        this.repository = repository;
    }

    @Transactional(readOnly = true)
    public Optional<String> get(String key) {
        return repository.findById(key).map(AppSetting::getValue);
    }

    @Transactional
    public void put(String key, String value, Instant now) {
        AppSetting s = repository.findById(key).orElseGet(() -> new AppSetting(key, null, now));
        s.setValue(value);
        s.setUpdatedAt(now);
        repository.save(s);
    }
}
