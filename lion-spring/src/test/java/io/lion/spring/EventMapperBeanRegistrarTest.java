package io.lion.spring;

import io.lion.integration.EventMapper;
import io.lion.integration.FlexibleEventMapper;
import io.lion.registry.MapperConfigurationException;
import io.lion.registry.MapperKey;
import io.lion.spring.injected.ClockedOrderMapper;
import io.lion.spring.mappers.OrderPlacedMapper;
import io.lion.spring.mappers.OrderPlacedNotification;
import io.lion.spring.mappers.OrderPlacedNotification.OrderPlaced;
import io.lion.spring.mappers.UserCreated;
import io.lion.spring.mappers.UserCreatedEventMapper;
import io.lion.spring.mappers.UserCreatedFlexibleEventMapper;
import io.lion.spring.mappers.UserCreatedNotification;
import io.lion.spring.mappers.UserRegistered;
import io.lion.spring.other.AlternativeUserCreatedMapper;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.config.BeanDefinition;
import org.springframework.context.support.GenericApplicationContext;
import org.springframework.core.ResolvableType;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class EventMapperBeanRegistrarTest {

    private static final String MAPPERS = "io.lion.spring.mappers";
    private static final String OTHER = "io.lion.spring.other";

    private final GenericApplicationContext context = new GenericApplicationContext();

    @AfterEach
    void closeContext() {
        context.close();
    }

    @Test
    void registersTypedMapperResolvableByCapability() {
        EventMapperBeanRegistrar.addEventMappers(context, MAPPERS);
        context.refresh();

        EventMapper<UserCreatedNotification> mapper = typedMapper(UserCreatedNotification.class);
        assertInstanceOf(UserCreatedEventMapper.class, mapper);

        var events = mapper.createEvents(new UserCreatedNotification(new UserCreated("u1", "a@b.c"))).join();
        assertEquals(List.of(new UserRegistered("u1")), events);
    }

    @Test
    void registersOneBeanDefinitionPerCapabilityInstantiation() {
        EventMapperBeanRegistrar.addEventMappers(context, MAPPERS);

        List<String> names = Arrays.stream(context.getBeanDefinitionNames())
                .filter(name -> context.getBeanDefinition(name).hasAttribute(EventMapperBeanRegistrar.MAPPER_KEY_ATTRIBUTE))
                .sorted()
                .toList();
        assertEquals(List.of(
                "EventMapper<" + OrderPlacedNotification.class.getName() + ">",
                "EventMapper<" + UserCreatedNotification.class.getName() + ">",
                "FlexibleEventMapper<" + OrderPlacedNotification.class.getName() + ">",
                "FlexibleEventMapper<" + UserCreatedNotification.class.getName() + ">"), names);
    }

    @Test
    void mapperBeansArePrototypes() {
        EventMapperBeanRegistrar.addEventMappers(context, MAPPERS);
        context.refresh();

        String beanName = EventMapperBeanRegistrar.beanName(MapperKey.typed(UserCreatedNotification.class));
        assertEquals(BeanDefinition.SCOPE_PROTOTYPE, context.getBeanDefinition(beanName).getScope());
        assertNotSame(typedMapper(UserCreatedNotification.class), typedMapper(UserCreatedNotification.class));
    }

    @Test
    void classImplementingBothCapabilitiesIsResolvableUnderEach() {
        EventMapperBeanRegistrar.addEventMappers(context, MAPPERS);
        context.refresh();

        EventMapper<OrderPlacedNotification> typed = typedMapper(OrderPlacedNotification.class);
        FlexibleEventMapper<OrderPlacedNotification> flexible = flexibleMapper(OrderPlacedNotification.class);

        assertInstanceOf(OrderPlacedMapper.class, typed);
        assertInstanceOf(OrderPlacedMapper.class, flexible);
        assertEquals(List.of("o-1"),
                flexible.createPayloads(new OrderPlacedNotification(new OrderPlaced("o-1"))).join());
    }

    @Test
    void typedAndFlexibleMappersForSameNotificationAreIndependent() {
        EventMapperBeanRegistrar.addEventMappers(context, MAPPERS);
        context.refresh();

        assertInstanceOf(UserCreatedEventMapper.class, typedMapper(UserCreatedNotification.class));
        assertInstanceOf(UserCreatedFlexibleEventMapper.class, flexibleMapper(UserCreatedNotification.class));
    }

    @Test
    void laterScanReplacesRegistrationForSameCapability() {
        EventMapperBeanRegistrar.addEventMappers(context, MAPPERS);
        EventMapperBeanRegistrar.addEventMappers(context, OTHER);
        context.refresh();

        assertInstanceOf(AlternativeUserCreatedMapper.class, typedMapper(UserCreatedNotification.class));
        assertInstanceOf(UserCreatedFlexibleEventMapper.class, flexibleMapper(UserCreatedNotification.class));
    }

    @Test
    void overlappingScansKeepOneDefinitionPerCapability() {
        EventMapperBeanRegistrar.addEventMappers(context, MAPPERS);
        int before = context.getBeanDefinitionCount();

        EventMapperBeanRegistrar.addEventMappers(context, MAPPERS, MAPPERS);

        assertEquals(before, context.getBeanDefinitionCount());
    }

    @Test
    void scansPackageOfMarkerClass() {
        EventMapperBeanRegistrar.addEventMappersFromPackageOf(context, AlternativeUserCreatedMapper.class);
        context.refresh();

        assertInstanceOf(AlternativeUserCreatedMapper.class, typedMapper(UserCreatedNotification.class));
    }

    @Test
    void returnsRegistryForChaining() {
        assertSame(context, EventMapperBeanRegistrar.addEventMappers(context, OTHER));
    }

    @Test
    void injectsConstructorDependencies() {
        Clock clock = Clock.fixed(Instant.parse("2024-01-01T00:00:00Z"), ZoneOffset.UTC);
        context.registerBean(Clock.class, () -> clock);
        EventMapperBeanRegistrar.addEventMappers(context, "io.lion.spring.injected");
        context.refresh();

        FlexibleEventMapper<OrderPlacedNotification> mapper = flexibleMapper(OrderPlacedNotification.class);
        assertInstanceOf(ClockedOrderMapper.class, mapper);
        assertEquals(List.of("o-2", clock.instant()),
                mapper.createPayloads(new OrderPlacedNotification(new OrderPlaced("o-2"))).join());
    }

    @Test
    void noPackagesIsAConfigurationError() {
        assertThrows(MapperConfigurationException.class,
                () -> EventMapperBeanRegistrar.addEventMappers(context, new String[0]));
        assertThrows(MapperConfigurationException.class,
                () -> EventMapperBeanRegistrar.addEventMappers(context, (String[]) null));
        assertThrows(MapperConfigurationException.class,
                () -> EventMapperBeanRegistrar.addEventMappers(context, " ", ""));
    }

    @Test
    void packageWithoutMappersRegistersNothing() {
        int before = context.getBeanDefinitionCount();

        EventMapperBeanRegistrar.addEventMappers(context, "io.lion.spring.nothing.here");

        assertEquals(before, context.getBeanDefinitionCount());
    }

    private <N> EventMapper<N> typedMapper(Class<N> notificationType) {
        return context.<EventMapper<N>>getBeanProvider(
                ResolvableType.forClassWithGenerics(EventMapper.class, notificationType)).getObject();
    }

    private <N> FlexibleEventMapper<N> flexibleMapper(Class<N> notificationType) {
        return context.<FlexibleEventMapper<N>>getBeanProvider(
                ResolvableType.forClassWithGenerics(FlexibleEventMapper.class, notificationType)).getObject();
    }
}
