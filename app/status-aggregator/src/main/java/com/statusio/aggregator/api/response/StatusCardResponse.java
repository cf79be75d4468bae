package com.statusio.aggregator.api.response;

import com.statusio.aggregator.service.render.StatusCard;

public record StatusCardResponse(String title, String description) {

  public static StatusCardResponse from(StatusCard card) {
    return new StatusCardResponse(card.title(), card.description());
  }
}
