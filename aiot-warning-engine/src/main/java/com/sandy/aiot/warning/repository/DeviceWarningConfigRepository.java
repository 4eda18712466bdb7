package com.sandy.aiot.warning.repository;

import com.sandy.aiot.warning.entity.DeviceWarningConfig;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface DeviceWarningConfigRepository extends JpaRepository<DeviceWarningConfig, String> {
}
