package com.acme.voice.repository;

import com.acme.voice.domain.IotNode;
import java.util.List;

public interface NodeRepository {

  /** Nodes of a house that belong to the given user. */
  List<IotNode> findByHouseAndUser(long houseId, String userId);

  int countActiveByHouse(long houseId);
}
