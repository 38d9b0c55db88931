package secops.threatgraph.common.function;

@FunctionalInterface
public interface ThrowingSupplier<T> {
  T get() throws Throwable;
}
