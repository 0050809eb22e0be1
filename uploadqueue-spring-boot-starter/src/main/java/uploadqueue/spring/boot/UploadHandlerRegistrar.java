package uploadqueue.spring.boot;

import org.springframework.beans.factory.BeanCreationException;
import org.springframework.beans.factory.ListableBeanFactory;
import org.springframework.beans.factory.SmartInitializingSingleton;
import uploadqueue.UploadHandler;
import uploadqueue.UploadType;
import uploadqueue.registry.DefaultHandlerRegistry;
import uploadqueue.registry.HandlerRegistry;

import java.util.EnumMap;
import java.util.Map;

/**
 * Scans for beans annotated with {@link UploadHandlerFor} and registers them
 * in the {@link DefaultHandlerRegistry}.
 *
 * <p>Runs after all singleton beans are initialized via {@link SmartInitializingSingleton},
 * so handlers are in place before the queue's startup pass. An application that supplies
 * its own {@link HandlerRegistry} routes its handlers itself; annotated beans are then
 * rejected at startup.
 *
 * @see UploadHandlerFor
 */
public class UploadHandlerRegistrar implements SmartInitializingSingleton {

    private final ListableBeanFactory beanFactory;
    private final HandlerRegistry registry;

    public UploadHandlerRegistrar(ListableBeanFactory beanFactory, HandlerRegistry registry) {
        this.beanFactory = beanFactory;
        this.registry = registry;
    }

    @Override
    public void afterSingletonsInstantiated() {
        Map<UploadType, String> claimedBy = new EnumMap<>(UploadType.class);
        Map<String, Object> beans = beanFactory.getBeansWithAnnotation(UploadHandlerFor.class);
        if (beans.isEmpty()) {
            return;
        }
        if (!(registry instanceof DefaultHandlerRegistry defaultRegistry)) {
            throw new IllegalStateException("@UploadHandlerFor beans " + beans.keySet()
                    + " cannot be registered on custom registry " + registry.getClass().getName());
        }
        for (Map.Entry<String, Object> entry : beans.entrySet()) {
            String beanName = entry.getKey();
            Object bean = entry.getValue();

            if (!(bean instanceof UploadHandler handler)) {
                throw new BeanCreationException(beanName,
                        "Bean annotated with @UploadHandlerFor must implement UploadHandler, " +
                                "but " + bean.getClass().getName() + " does not");
            }

            // Proxies may hide the annotation; the bean factory resolves it on the target class
            UploadHandlerFor annotation = beanFactory.findAnnotationOnBean(beanName, UploadHandlerFor.class);
            if (annotation == null || annotation.value().length == 0) {
                throw new BeanCreationException(beanName,
                        "@UploadHandlerFor must name at least one upload type");
            }

            for (UploadType type : annotation.value()) {
                String previous = claimedBy.putIfAbsent(type, beanName);
                if (previous != null) {
                    throw new BeanCreationException(beanName,
                            "Upload type " + type + " is already handled by bean '" + previous + "'");
                }
                defaultRegistry.register(type, handler);
            }
        }
    }
}
