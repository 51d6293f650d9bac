package com.acme.voice.repository;

import com.acme.voice.domain.MaintenanceRecord;
import java.util.List;

public interface MaintenanceRepository {

  List<MaintenanceRecord> findByUser(String userId, int limit);

  int countPendingByHouse(long houseId);

  /**
   * Insert a new maintenance request.
   *
   * @return the generated id
   */
  long create(MaintenanceRecord maintenanceRecord);
}
