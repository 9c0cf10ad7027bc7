package nik.notes.core.suggestion;

import java.util.ArrayList;
import java.util.List;
import nik.notes.core.domain.model.RequestParameters;
import nik.notes.core.domain.model.SuggestionList;
import nik.notes.core.domain.model.TransportMethod;
import nik.notes.core.domain.model.TravelStyle;
import nik.notes.core.port.out.MockBackend;

/**
 * 결정적 대체 추천 생성기
 *
 * <p>생성 백엔드가 없거나 실패/타임아웃일 때 사용됩니다. 입력이 같으면 항상 같은 목록을 반환하며 I/O가 없습니다. 수량은 인원수와 여행 일수에
 * 비례합니다.
 */
public class MockSuggestionGenerator implements MockBackend {

  static final int MAX_ITEMS = 15;

  @Override
  public SuggestionList generate(RequestParameters params) {
    int travelers = Math.max(1, params.travelers().total());
    int days = Math.max(1, params.durationDays());

    List<String> items = new ArrayList<>();
    items.add(line(travelers, "Passport and travel documents"));
    items.add(line(travelers, "Phone charger"));
    items.add(line(travelers, "Comfortable walking shoes"));
    items.add(line(days, "T-shirts"));
    items.add(line(days, "Pairs of socks"));
    items.add(line(days + 2, "Underwear"));
    items.add(line(travelers, "Toothbrush"));
    items.add(line(1, "Toothpaste"));
    items.add(line(travelers, "Deodorant"));
    items.add(line(1, "Sunscreen"));
    items.add(line(travelers, "Reusable water bottle"));

    if (params.travelStyle() == TravelStyle.BUSINESS) {
      items.add(line(days, "Business shirts"));
      items.add(line(travelers, "Laptop and accessories"));
      items.add(line(1, "Business cards holder"));
    } else if (params.travelStyle() == TravelStyle.ADVENTURE) {
      items.add(line(travelers, "Hiking boots"));
      items.add(line(travelers, "Backpack"));
      items.add(line(1, "First aid kit"));
    }

    if (params.transportMethod() == TransportMethod.FLIGHT) {
      items.add(line(travelers, "Luggage tags"));
      items.add(line(travelers, "Travel pillow"));
      items.add(line(travelers, "Eye mask"));
    }

    return SuggestionList.mock(items.subList(0, Math.min(MAX_ITEMS, items.size())));
  }

  private static String line(int quantity, String item) {
    return quantity + " x " + item;
  }
}
