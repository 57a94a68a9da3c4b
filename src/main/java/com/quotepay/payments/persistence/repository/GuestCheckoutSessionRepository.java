package com.quotepay.payments.persistence.repository;

import com.quotepay.payments.persistence.entity.GuestCheckoutSessionEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface GuestCheckoutSessionRepository extends JpaRepository<GuestCheckoutSessionEntity, String> {
}
