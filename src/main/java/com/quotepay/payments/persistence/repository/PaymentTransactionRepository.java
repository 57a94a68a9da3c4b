package com.quotepay.payments.persistence.repository;

import com.quotepay.payments.domain.PaymentState;
import com.quotepay.payments.persistence.entity.PaymentTransactionEntity;
import jakarta.persistence.LockModeType;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface PaymentTransactionRepository extends JpaRepository<PaymentTransactionEntity, String> {

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT p FROM PaymentTransactionEntity p WHERE p.transactionId = :transactionId")
    Optional<PaymentTransactionEntity> findForUpdate(@Param("transactionId") String transactionId);

    Optional<PaymentTransactionEntity> findFirstByGatewayTransactionId(String gatewayTransactionId);

    Page<PaymentTransactionEntity> findByPaymentStateOrderByCreatedAtDesc(PaymentState paymentState, Pageable pageable);
}
