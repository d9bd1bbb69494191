package com.GlobeLine.price_broadcaster.mapper;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import org.springframework.stereotype.Component;

import com.GlobeLine.price_broadcaster.dto.PriceQuote;
import com.GlobeLine.price_broadcaster.dto.PriceUpdateItem;
import com.GlobeLine.price_broadcaster.dto.PriceUpdateMessage;
import com.GlobeLine.price_broadcaster.topic.TopicItem;
import com.GlobeLine.price_broadcaster.topic.WatchlistTopic;

/**
 * Merges a topic's items with the quotes fetched for it into one price_update message.
 * Items keep the topic's order; a symbol without an available quote gets null price fields.
 */
@Component
public class PriceUpdateMapper {

	public PriceUpdateMessage toMessage(WatchlistTopic topic, Map<String, PriceQuote> quotes, Instant timestamp) {
		List<PriceUpdateItem> items = new ArrayList<>(topic.items().size());
		for (TopicItem item : topic.items()) {
			PriceQuote quote = quotes.get(item.symbol());
			items.add(toItem(item, quote != null && quote.available() ? quote : null));
		}
		return PriceUpdateMessage.of(topic.id(), items, timestamp.toString());
	}

	private PriceUpdateItem toItem(TopicItem item, PriceQuote quote) {
		BigDecimal price = quote != null ? quote.price() : null;
		return new PriceUpdateItem(
				item.symbol(),
				item.displayName(),
				price,
				quote != null ? quote.delta() : null,
				quote != null ? quote.deltaPercent() : null,
				item.quantity(),
				item.purchasePrice(),
				unrealizedPnl(item, price));
	}

	private BigDecimal unrealizedPnl(TopicItem item, BigDecimal price) {
		if (price == null || item.quantity() == null || item.purchasePrice() == null) {
			return null;
		}
		return price.subtract(item.purchasePrice())
				.multiply(item.quantity())
				.setScale(2, RoundingMode.HALF_UP);
	}
}
