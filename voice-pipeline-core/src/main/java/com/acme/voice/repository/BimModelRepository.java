package com.acme.voice.repository;

import com.acme.voice.domain.BimModel;
import java.util.List;
import java.util.Map;

public interface BimModelRepository {

  List<BimModel> findPendingByUser(String userId);

  /** Model count per conversion status for a user. */
  Map<String, Integer> countByStatus(String userId);
}
