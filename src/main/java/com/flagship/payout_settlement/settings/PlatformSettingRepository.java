package com.flagship.payout_settlement.settings;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface PlatformSettingRepository extends JpaRepository<PlatformSettingEntity, String> {

    List<PlatformSettingEntity> findByCategoryOrderByKeyAsc(String category);

    List<PlatformSettingEntity> findAllByOrderByCategoryAscKeyAsc();
}
