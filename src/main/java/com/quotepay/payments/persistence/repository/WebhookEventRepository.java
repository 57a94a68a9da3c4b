package com.quotepay.payments.persistence.repository;

import com.quotepay.payments.domain.GatewayCode;
import com.quotepay.payments.persistence.entity.WebhookEventEntity;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface WebhookEventRepository extends JpaRepository<WebhookEventEntity, Long> {

    Optional<WebhookEventEntity> findByGatewayCodeAndEventId(GatewayCode gatewayCode, String eventId);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT w FROM WebhookEventEntity w WHERE w.id = :id")
    Optional<WebhookEventEntity> findForUpdate(@Param("id") Long id);
}
