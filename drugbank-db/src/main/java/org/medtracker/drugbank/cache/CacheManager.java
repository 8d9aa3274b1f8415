package org.medtracker.drugbank.cache;

/*
 * This file is part of MedTracker.
 *
 * Copyright (C) 2025 The MedTracker Authors
 *
 * MedTracker is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as published by
 * the Free Software Foundation, either version 3 of the License, or
 * (at your option) any later version.
 *
 * MedTracker is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Public License for more details.
 *
 * You should have received a copy of the GNU General Public License
 * along with MedTracker.  If not, see <https://www.gnu.org/licenses/>.
 */

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

import org.medtracker.drugbank.conf.ConfigLoader;
import org.medtracker.drugbank.util.Logger;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Ticker;

/**
 * In-memory cache with one Caffeine cache per {@link CacheTier}, each with its
 * own TTL and the same entry bound.
 *
 * <p>An entry is live while {@code now < storedAt + ttl}; the time source is
 * the injected {@link Clock}. Expired entries are never returned and are
 * evicted during Caffeine's routine maintenance, so one-off keys do not pile
 * up. The cache knows nothing about what it stores; callers decide what to put
 * and under which key.</p>
 *
 * <pre>
 * CacheManager cache = CacheManager.fromConfig(cfg);
 * CacheKey key = CacheKey.pair("aspirin", "warfarin");
 * List&lt;?&gt; hit = cache.get(key, List.class).orElse(null);
 * </pre>
 */
public class CacheManager {

	private final Map<CacheTier, Cache<String, Object>> tiers = new EnumMap<>(CacheTier.class);
	private final Map<CacheTier, Duration> ttls = new EnumMap<>(CacheTier.class);

	/** All tiers at their default TTL and size bound, on the system clock. */
	public CacheManager() {
		this(Map.of(), Clock.systemUTC());
	}

	/**
	 * @param ttls  TTL per tier; tiers not present use {@link CacheTier#getDefaultTtl()}
	 * @param clock time source
	 */
	public CacheManager(Map<CacheTier, Duration> ttls, Clock clock) {
		this(ttls, ConfigLoader.DEFAULT_CACHE_MAX_ENTRIES, clock);
	}

	/**
	 * @param ttls       TTL per tier; tiers not present use {@link CacheTier#getDefaultTtl()}
	 * @param maxEntries entries kept per tier before eviction
	 * @param clock      time source
	 */
	public CacheManager(Map<CacheTier, Duration> ttls, long maxEntries, Clock clock) {
		if (clock == null) {
			throw new IllegalArgumentException("clock must not be null");
		}
		if (maxEntries <= 0) {
			throw new IllegalArgumentException("maxEntries must be positive: " + maxEntries);
		}
		Ticker ticker = () -> {
			Instant now = clock.instant();
			return TimeUnit.SECONDS.toNanos(now.getEpochSecond()) + now.getNano();
		};
		for (CacheTier t : CacheTier.values()) {
			Duration ttl = ttls == null ? null : ttls.get(t);
			if (ttl == null) {
				ttl = t.getDefaultTtl();
			}
			if (ttl.isNegative() || ttl.isZero()) {
				throw new IllegalArgumentException("TTL for " + t + " must be positive: " + ttl);
			}
			this.ttls.put(t, ttl);
			Cache<String, Object> cache = Caffeine.newBuilder()
					.expireAfterWrite(ttl)
					.maximumSize(maxEntries)
					.ticker(ticker)
					.executor(Runnable::run)
					.recordStats()
					.build();
			tiers.put(t, cache);
		}
	}

	public static CacheManager fromConfig(ConfigLoader cfg) {
		Map<CacheTier, Duration> ttls = new EnumMap<>(CacheTier.class);
		ttls.put(CacheTier.RESPONSE, cfg.getCacheResponseTtl());
		ttls.put(CacheTier.DRUG, cfg.getCacheDrugTtl());
		ttls.put(CacheTier.PAIR, cfg.getCachePairTtl());
		return new CacheManager(ttls, cfg.getCacheMaxEntries(), Clock.systemUTC());
	}

	public Duration getTtl(CacheTier tier) {
		return ttls.get(tier);
	}

	/** Live value for {@code key}, else empty. Every call counts as a hit or a miss. */
	public Optional<Object> get(CacheKey key) {
		Object value = tiers.get(key.getTier()).getIfPresent(key.getFingerprint());
		if (value != null) {
			Logger.debug("Cache hit: {} {}", key.getTier(), key.getFingerprint());
		}
		return Optional.ofNullable(value);
	}

	/**
	 * Typed lookup. A live value of another type is reported as empty (the
	 * lookup still counts as a hit).
	 */
	public <T> Optional<T> get(CacheKey key, Class<T> type) {
		return get(key).filter(type::isInstance).map(type::cast);
	}

	/** Store or replace the value for {@code key}; its TTL starts now. */
	public void put(CacheKey key, Object value) {
		if (value == null) {
			throw new IllegalArgumentException("Cannot cache a null value for " + key);
		}
		tiers.get(key.getTier()).put(key.getFingerprint(), value);
		Logger.debug("Cache store: {} {}", key.getTier(), key.getFingerprint());
	}

	public Map<CacheTier, CacheStats> stats() {
		Map<CacheTier, CacheStats> out = new EnumMap<>(CacheTier.class);
		for (CacheTier t : CacheTier.values()) {
			out.put(t, stats(t));
		}
		return out;
	}

	public CacheStats stats(CacheTier tier) {
		Cache<String, Object> c = tiers.get(tier);
		c.cleanUp();
		return new CacheStats(c.stats().hitCount(), c.stats().missCount(), (int) c.estimatedSize());
	}

	/** Empty every tier. Hit and miss counters are kept. */
	public void clear() {
		for (CacheTier t : CacheTier.values()) {
			clear(t);
		}
	}

	public void clear(CacheTier tier) {
		Cache<String, Object> c = tiers.get(tier);
		long removed = c.estimatedSize();
		c.invalidateAll();
		c.cleanUp();
		Logger.info("Cleared {} cache ({} entries)", tier, removed);
	}

	/** Evict expired entries from every tier now; returns how many were removed. */
	public int purgeExpired() {
		long removed = 0;
		for (Cache<String, Object> c : tiers.values()) {
			long before = c.estimatedSize();
			c.cleanUp();
			removed += before - c.estimatedSize();
		}
		return (int) removed;
	}
}
