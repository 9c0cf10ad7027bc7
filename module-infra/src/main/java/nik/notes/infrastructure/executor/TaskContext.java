package nik.notes.infrastructure.executor;

import java.util.Objects;

/**
 * 로그/메트릭용 작업 컨텍스트
 *
 * <h3>형식</h3>
 *
 * <pre>
 * "component:operation:dynamicValue"
 *
 * 예시:
 * - TaskContext.of("CacheStore", "get", "ai_suggestions:3f2a****")
 *   → "CacheStore:get:ai_suggestions:3f2a****"
 * - TaskContext.of("Gemini", "generate")
 *   → "Gemini:generate"
 * </pre>
 *
 * <ul>
 *   <li>component, operation: 고정 값 (메트릭 태그로 사용 가능)
 *   <li>dynamicValue: 로그에만 기록 (키는 마스킹해서 넘길 것)
 * </ul>
 *
 * @param component 컴포넌트 이름
 * @param operation 작업 유형
 * @param dynamicValue 동적 값
 */
public record TaskContext(String component, String operation, String dynamicValue) {

  public TaskContext {
    Objects.requireNonNull(component, "component");
    Objects.requireNonNull(operation, "operation");
    if (dynamicValue == null) {
      dynamicValue = "";
    }
  }

  public static TaskContext of(String component, String operation, String dynamicValue) {
    return new TaskContext(component, operation, dynamicValue);
  }

  public static TaskContext of(String component, String operation) {
    return new TaskContext(component, operation, "");
  }

  public String toTaskName() {
    if (dynamicValue.isEmpty()) {
      return component + ":" + operation;
    }
    return component + ":" + operation + ":" + dynamicValue;
  }
}
