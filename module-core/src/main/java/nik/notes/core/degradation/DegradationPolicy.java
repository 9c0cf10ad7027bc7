package nik.notes.core.degradation;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import nik.notes.core.domain.model.CapabilityState;
import nik.notes.core.domain.model.CapabilityStatus;

/**
 * 의존성 상태 → 동작 결정 테이블 (순수 함수, I/O 없음)
 *
 * <pre>
 * | Role               | Unavailable 시 동작      |
 * |--------------------|--------------------------|
 * | DURABLE_STORE      | FAIL_HARD (호출자에 전파) |
 * | CACHE              | BYPASS_CACHE             |
 * | GENERATION_BACKEND | USE_MOCK_GENERATOR       |
 * | AUXILIARY_CONTEXT  | OMIT_CONTEXT             |
 * </pre>
 *
 * <p>AVAILABLE, DEGRADED(프로빙 중)는 모두 PROCEED. 전역 "시스템 헬스" 플래그는 없으며 각 의존성은 자신의 어댑터 상태로만 판단합니다.
 */
public final class DegradationPolicy {

  private static final Map<DependencyRole, DegradationAction> ON_UNAVAILABLE;

  static {
    EnumMap<DependencyRole, DegradationAction> table = new EnumMap<>(DependencyRole.class);
    table.put(DependencyRole.DURABLE_STORE, DegradationAction.FAIL_HARD);
    table.put(DependencyRole.CACHE, DegradationAction.BYPASS_CACHE);
    table.put(DependencyRole.GENERATION_BACKEND, DegradationAction.USE_MOCK_GENERATOR);
    table.put(DependencyRole.AUXILIARY_CONTEXT, DegradationAction.OMIT_CONTEXT);
    ON_UNAVAILABLE = Collections.unmodifiableMap(table);
  }

  private DegradationPolicy() {}

  public static DegradationAction decide(DependencyRole role, CapabilityStatus status) {
    Objects.requireNonNull(role, "role");
    Objects.requireNonNull(status, "status");
    if (status != CapabilityStatus.UNAVAILABLE) {
      return DegradationAction.PROCEED;
    }
    return ON_UNAVAILABLE.get(role);
  }

  public static DegradationAction decide(DependencyRole role, CapabilityState state) {
    return decide(role, state.status());
  }

  /** Convenience for boolean health checks ({@code health() == false} means Unavailable). */
  public static DegradationAction decide(DependencyRole role, boolean healthy) {
    return decide(role, healthy ? CapabilityStatus.AVAILABLE : CapabilityStatus.UNAVAILABLE);
  }
}
