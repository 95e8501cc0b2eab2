package za.co.analytics.pipeline.derived_metrics_batch.reader;

import za.co.analytics.pipeline.derived_metrics_batch.model.FactActivity;
import za.co.analytics.pipeline.derived_metrics_batch.model.ProductSalesHistory;
import za.co.analytics.pipeline.derived_metrics_batch.model.UsageKey;
import org.jspecify.annotations.Nullable;
import org.springframework.batch.infrastructure.item.ExecutionContext;
import org.springframework.batch.infrastructure.item.ItemStreamException;
import org.springframework.batch.infrastructure.item.ItemStreamReader;

import java.util.ArrayList;
import java.util.List;

/**
 * Folds a key-ordered stream of fact rows into one {@link ProductSalesHistory} per
 * (pharmacy, product). The delegate must return rows sorted by pharmacy id, then product id.
 */
public class ProductSalesHistoryReader implements ItemStreamReader<ProductSalesHistory> {

    private final ItemStreamReader<FactActivity> delegate;

    private @Nullable FactActivity pending;

    public ProductSalesHistoryReader(ItemStreamReader<FactActivity> delegate) {
        this.delegate = delegate;
    }

    @Override
    public @Nullable ProductSalesHistory read() throws Exception {
        FactActivity first = pending != null ? pending : delegate.read();
        pending = null;
        if (first == null) {
            return null;
        }

        UsageKey key = first.key();
        List<FactActivity> sales = new ArrayList<>();
        sales.add(first);

        FactActivity next;
        while ((next = delegate.read()) != null) {
            if (!key.equals(next.key())) {
                pending = next;
                break;
            }
            sales.add(next);
        }
        return new ProductSalesHistory(key, sales);
    }

    @Override
    public void open(ExecutionContext executionContext) throws ItemStreamException {
        pending = null;
        delegate.open(executionContext);
    }

    @Override
    public void update(ExecutionContext executionContext) throws ItemStreamException {
        delegate.update(executionContext);
    }

    @Override
    public void close() throws ItemStreamException {
        pending = null;
        delegate.close();
    }
}
