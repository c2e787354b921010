package com.tony.transferMarket.repository;

import com.tony.transferMarket.model.GameSave;
import org.springframework.data.jpa.repository.JpaRepository;

public interface GameSaveRepository extends JpaRepository<GameSave, Long> {
}
