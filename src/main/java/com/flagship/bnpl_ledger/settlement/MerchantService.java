package com.flagship.bnpl_ledger.settlement;

import com.flagship.bnpl_ledger.exception.LedgerValidationException;
import com.flagship.bnpl_ledger.exception.ResourceNotFoundException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.UUID;

@Service
@RequiredArgsConstructor
@Slf4j
public class MerchantService {

    private final MerchantRepository merchantRepository;
    private final Clock clock;

    @Transactional
    public Merchant registerMerchant(String businessName, BankDetails bankDetails) {
        Merchant merchant = Merchant.register(UUID.randomUUID(), businessName, bankDetails, clock.instant());
        merchantRepository.save(MerchantEntity.fromDomain(merchant));
        log.info("Registered merchant {} ({})", merchant.getId(), merchant.getBusinessName());
        return merchant;
    }

    @Transactional(readOnly = true)
    public Merchant getMerchant(UUID merchantId) {
        return merchantRepository.findById(merchantId)
            .map(MerchantEntity::toDomain)
            .orElseThrow(() -> new ResourceNotFoundException("Merchant", merchantId));
    }

    @Transactional
    public Merchant changeStatus(UUID merchantId, MerchantStatus status) {
        if (status == null) {
            throw new LedgerValidationException("Status is required");
        }
        MerchantEntity entity = merchantRepository.findByIdForUpdate(merchantId)
            .orElseThrow(() -> new ResourceNotFoundException("Merchant", merchantId));
        Merchant updated = entity.toDomain().withStatus(status, clock.instant());
        entity.updateFromDomain(updated);
        merchantRepository.save(entity);
        log.info("Merchant {} status changed to {}", merchantId, status);
        return updated;
    }
}
