/**
 * Value types shared by the scheduler, the delivery worker and the persistence SPIs.
 *
 * @see dailymsg.model.ScheduledDelivery
 * @see dailymsg.model.DeliveryStatus
 */
package dailymsg.model;
