package io.syncevents.spring.boot;

import io.syncevents.SyncClient;
import io.syncevents.SyncEvent;
import io.syncevents.context.ContextShape;
import io.syncevents.context.GlobalEventContext;
import io.syncevents.context.RoomEventContext;
import io.syncevents.event.EventKind;
import io.syncevents.event.EventTag;
import io.syncevents.event.EventTypes;
import io.syncevents.handler.EventHandler;
import io.syncevents.handler.GlobalEventHandler;
import io.syncevents.handler.RoomEventHandler;

import org.springframework.aop.support.AopUtils;
import org.springframework.beans.factory.BeanCreationException;
import org.springframework.beans.factory.ListableBeanFactory;
import org.springframework.beans.factory.SmartInitializingSingleton;
import org.springframework.core.MethodIntrospector;
import org.springframework.core.annotation.AnnotatedElementUtils;
import org.springframework.util.ClassUtils;

import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.util.Map;
import java.util.logging.Logger;

/**
 * Scans singleton beans for methods annotated with {@link SyncEventHandler} and
 * registers them with the {@link SyncClient}.
 *
 * <p>Runs after all singleton beans are initialized via {@link SmartInitializingSingleton}.
 * An invalid handler method fails startup with a {@link BeanCreationException}.
 *
 * @see SyncEventHandler
 */
public class SyncEventHandlerRegistrar implements SmartInitializingSingleton {
    private static final Logger logger = Logger.getLogger(SyncEventHandlerRegistrar.class.getName());

    private final ListableBeanFactory beanFactory;
    private final SyncClient client;

    public SyncEventHandlerRegistrar(ListableBeanFactory beanFactory, SyncClient client) {
        this.beanFactory = beanFactory;
        this.client = client;
    }

    @Override
    public void afterSingletonsInstantiated() {
        for (String beanName : beanFactory.getBeanNamesForType(Object.class, false, false)) {
            Class<?> beanType = beanFactory.getType(beanName);
            if (beanType == null) {
                continue;
            }
            Class<?> userType = ClassUtils.getUserClass(beanType);
            Map<Method, SyncEventHandler> methods = MethodIntrospector.selectMethods(userType,
                    (MethodIntrospector.MetadataLookup<SyncEventHandler>) method ->
                            AnnotatedElementUtils.findMergedAnnotation(method, SyncEventHandler.class));
            if (methods.isEmpty()) {
                continue;
            }
            Object bean = beanFactory.getBean(beanName);
            for (Map.Entry<Method, SyncEventHandler> entry : methods.entrySet()) {
                register(beanName, bean, entry.getKey(), entry.getValue());
            }
        }
    }

    private void register(String beanName, Object bean, Method method, SyncEventHandler annotation) {
        EventTag tag = resolveTag(beanName, method, annotation);
        ContextShape shape = resolveShape(beanName, method);
        Method invocable = AopUtils.selectInvocableMethod(method, bean.getClass());
        invocable.setAccessible(true);

        Object callback = switch (shape) {
            case NONE -> (EventHandler) event -> invoke(invocable, bean, event);
            case ROOM -> (RoomEventHandler) (event, ctx) -> invoke(invocable, bean, event, ctx);
            case GLOBAL -> (GlobalEventHandler) (event, ctx) -> invoke(invocable, bean, event, ctx);
        };
        try {
            client.addEventHandler(tag, shape, callback);
        } catch (IllegalArgumentException e) {
            throw new BeanCreationException(beanName,
                    "Invalid @SyncEventHandler " + describe(method) + ": " + e.getMessage(), e);
        }
        logger.fine(() -> "Registered " + describe(method) + " for " + tag);
    }

    private EventTag resolveTag(String beanName, Method method, SyncEventHandler annotation) {
        if (annotation.kind() == EventKind.CUSTOM) {
            return EventTypes.CUSTOM_EVENT;
        }
        if (annotation.type().isEmpty()) {
            throw new BeanCreationException(beanName,
                    "@SyncEventHandler " + describe(method) + " must specify a type for kind "
                            + annotation.kind().wireName());
        }
        return EventTag.of(annotation.kind(), annotation.type());
    }

    private ContextShape resolveShape(String beanName, Method method) {
        if (method.getReturnType() != void.class) {
            throw new BeanCreationException(beanName,
                    "@SyncEventHandler " + describe(method) + " must return void");
        }
        Class<?>[] params = method.getParameterTypes();
        if (params.length == 1 && params[0] == SyncEvent.class) {
            return ContextShape.NONE;
        }
        if (params.length == 2 && params[0] == SyncEvent.class) {
            if (params[1] == RoomEventContext.class) {
                return ContextShape.ROOM;
            }
            if (params[1] == GlobalEventContext.class) {
                return ContextShape.GLOBAL;
            }
        }
        throw new BeanCreationException(beanName,
                "@SyncEventHandler " + describe(method) + " must take (SyncEvent), "
                        + "(SyncEvent, RoomEventContext) or (SyncEvent, GlobalEventContext)");
    }

    private static void invoke(Method method, Object bean, Object... args) throws Exception {
        try {
            method.invoke(bean, args);
        } catch (InvocationTargetException e) {
            Throwable cause = e.getCause();
            if (cause instanceof Exception ex) {
                throw ex;
            }
            if (cause instanceof Error err) {
                throw err;
            }
            throw e;
        }
    }

    private static String describe(Method method) {
        return method.getDeclaringClass().getSimpleName() + "#" + method.getName();
    }
}
