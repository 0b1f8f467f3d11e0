package com.flagship.bnpl_ledger.installment;

import com.flagship.bnpl_ledger.exception.InvariantViolationException;
import com.flagship.bnpl_ledger.exception.ResourceNotFoundException;
import com.flagship.bnpl_ledger.reference.ReferenceGenerator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Persistence of repayment plans and their schedules.
 *
 * Plans are only ever written inside a transaction-level operation (accept, payment, overdue
 * sweep), so every write method requires an existing transaction.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class RepaymentPlanService {

    private final RepaymentPlanRepository planRepository;
    private final RepaymentScheduleRepository scheduleRepository;
    private final InstallmentPlanGenerator generator;
    private final ReferenceGenerator referenceGenerator;
    private final Clock clock;

    @Transactional(propagation = Propagation.MANDATORY)
    public PlanSchedule createPlan(UUID transactionId, UUID customerId, PlanType planType,
                                   BigDecimal totalAmount, LocalDate firstDueDate) {
        List<ScheduledInstallment> installments = generator.generate(totalAmount, planType, firstDueDate);
        Instant now = clock.instant();

        RepaymentPlan plan = RepaymentPlan.create(UUID.randomUUID(), referenceGenerator.plan(), transactionId,
            customerId, planType, totalAmount, generator.baseInstallment(totalAmount, planType), installments, now);
        planRepository.save(RepaymentPlanEntity.fromDomain(plan));

        List<ScheduleRow> rows = installments.stream()
            .map(installment -> ScheduleRow.from(plan.getId(), installment))
            .toList();
        scheduleRepository.saveAll(rows.stream().map(RepaymentScheduleEntity::fromDomain).toList());

        log.info("Created plan {} with {} installments of {} starting {}",
            plan.getPlanReference(), plan.getNumberOfInstallments(), plan.getInstallmentAmount(), firstDueDate);
        return new PlanSchedule(plan, rows);
    }

    /**
     * Locks the plan and then all of its rows.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public PlanSchedule lockPlan(UUID transactionId) {
        RepaymentPlanEntity plan = planRepository.findByTransactionIdForUpdate(transactionId)
            .orElseThrow(() -> new ResourceNotFoundException("Repayment plan for transaction", transactionId));
        List<ScheduleRow> rows = scheduleRepository.findByPlanIdForUpdate(plan.getId()).stream()
            .map(RepaymentScheduleEntity::toDomain)
            .toList();
        return new PlanSchedule(plan.toDomain(), rows);
    }

    /**
     * Writes back the rows a payment touched and the recomputed plan counters.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public RepaymentPlan recordPayment(UUID planId, BigDecimal amount, List<ScheduleRow> rowsAfter) {
        RepaymentPlanEntity planEntity = planRepository.findById(planId)
            .orElseThrow(() -> new ResourceNotFoundException("Repayment plan", planId));
        RepaymentPlan updated = planEntity.toDomain().recordPayment(amount, rowsAfter, clock.instant());

        writeRows(planId, rowsAfter);
        planEntity.updateFromDomain(updated);
        planRepository.save(planEntity);
        return updated;
    }

    /**
     * Caches OVERDUE on every PENDING row of the plan that is past due.
     *
     * @return the number of rows flagged
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public int flagOverdueRows(UUID transactionId, LocalDate today) {
        PlanSchedule schedule = lockPlan(transactionId);
        List<ScheduleRow> flagged = schedule.getRows().stream()
            .filter(row -> row.getStatus() == InstallmentStatus.PENDING && row.isOverdue(today))
            .map(ScheduleRow::markOverdue)
            .toList();
        writeRows(schedule.getPlan().getId(), flagged);
        return flagged.size();
    }

    @Transactional(readOnly = true)
    public PlanSchedule getPlan(UUID transactionId) {
        RepaymentPlanEntity plan = planRepository.findByTransactionId(transactionId)
            .orElseThrow(() -> new ResourceNotFoundException("Repayment plan for transaction", transactionId));
        LocalDate today = LocalDate.now(clock);
        List<ScheduleRow> rows = scheduleRepository.findByPlanIdOrderByInstallmentNumberAsc(plan.getId()).stream()
            .map(RepaymentScheduleEntity::toDomain)
            .map(row -> row.isOverdue(today) ? row.markOverdue() : row)
            .toList();
        return new PlanSchedule(plan.toDomain(), rows);
    }

    @Transactional(readOnly = true)
    public List<UUID> transactionsWithRowsPastDue(LocalDate today) {
        return planRepository.findTransactionIdsWithRowsDueBefore(List.of(InstallmentStatus.PENDING), today);
    }

    private void writeRows(UUID planId, List<ScheduleRow> rows) {
        if (rows.isEmpty()) {
            return;
        }
        Map<UUID, RepaymentScheduleEntity> entities = new HashMap<>();
        scheduleRepository.findByPlanIdOrderByInstallmentNumberAsc(planId)
            .forEach(entity -> entities.put(entity.getId(), entity));
        for (ScheduleRow row : rows) {
            RepaymentScheduleEntity entity = entities.get(row.getId());
            if (entity == null) {
                throw new InvariantViolationException("Schedule row " + row.getId() + " does not belong to plan " + planId);
            }
            entity.updateFromDomain(row);
        }
        scheduleRepository.saveAll(entities.values());
    }
}
