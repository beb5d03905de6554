package br.com.pvss.webhookreceiver.repository;

import br.com.pvss.webhookreceiver.exception.ListingNotSupportedException;
import br.com.pvss.webhookreceiver.model.StoreHealth;
import br.com.pvss.webhookreceiver.model.StoreShape;
import br.com.pvss.webhookreceiver.model.StoredRecord;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.List;

public interface EventStore {

    StoreShape shape();

    String backend();

    Mono<Void> put(String key, StoredRecord record, Duration ttl);

    Mono<StoredRecord> getLatest(String key);

    Mono<List<StoredRecord>> getAll(String key);

    Mono<Boolean> delete(String key);

    Mono<StoreHealth> health();

    default Flux<String> listKeys(int limit) {
        return Flux.error(new ListingNotSupportedException(backend()));
    }
}
