package nik.notes.service.suggestion;

import nik.notes.core.domain.model.Fingerprint;
import nik.notes.core.domain.model.SuggestionList;

/** 제안 결과와 그 결과가 저장된(또는 저장될) 캐시 키 */
public record SuggestionOutcome(Fingerprint fingerprint, SuggestionList suggestions) {}
