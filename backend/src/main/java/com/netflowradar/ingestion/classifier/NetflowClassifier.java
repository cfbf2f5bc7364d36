package com.netflowradar.ingestion.classifier;

import com.netflowradar.ingestion.decoder.TransferEvent;
import com.netflowradar.ingestion.registry.ExchangeRegistry;
import com.netflowradar.ingestion.registry.MonitoredAddressSet;
import org.springframework.stereotype.Component;

import java.math.BigInteger;
import java.util.List;

/**
 * Classifies a transfer as inflow to, outflow from, or unrelated to an exchange.
 * When both sides are monitored by the same exchange the receiving side wins (inflow).
 */
@Component
public class NetflowClassifier {

    public ClassifiedFlow classify(TransferEvent event, MonitoredAddressSet registry) {
        if (registry.contains(event.toAddress())) {
            return new ClassifiedFlow(registry.label(), event.amount(), BigInteger.ZERO);
        }
        if (registry.contains(event.fromAddress())) {
            return new ClassifiedFlow(registry.label(), BigInteger.ZERO, event.amount());
        }
        return ClassifiedFlow.none(registry.label());
    }

    /**
     * Classifies against every exchange and keeps the relevant flows, in registry order.
     * A transfer between two different exchanges yields one outflow and one inflow.
     */
    public List<ClassifiedFlow> classifyAll(TransferEvent event, ExchangeRegistry registry) {
        return registry.exchanges().stream()
                .map(exchange -> classify(event, exchange))
                .filter(ClassifiedFlow::isRelevant)
                .toList();
    }
}
