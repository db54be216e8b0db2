package xyz.firestige.clouddeploy.infrastructure.event;

/**
 * 领域事件发布器
 */
public interface DomainEventPublisher {

    void publish(Object event);
}
